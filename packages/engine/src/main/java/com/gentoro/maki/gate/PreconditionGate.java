package com.gentoro.maki.gate;

import com.gentoro.maki.batch.BatchJob;
import com.gentoro.maki.batch.BatchJobManager;
import com.gentoro.maki.logging.LoggingService;
import com.gentoro.maki.mode.Mode;
import com.gentoro.maki.model.LlmClient;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;

/**
 * Decides whether a run may start. Checks, in order: every required model is available, then no
 * batch job of the same mode is still in flight. The job check is a read-then-decide lease; two
 * runs racing between the check and submission may both pass.
 */
public class PreconditionGate {
  private static final Logger log = LoggingService.getLogger(PreconditionGate.class);

  private final List<LlmClient> requiredModels;
  private final BatchJobManager batchJobs;

  public PreconditionGate(List<LlmClient> requiredModels, BatchJobManager batchJobs) {
    this.requiredModels = List.copyOf(requiredModels);
    this.batchJobs = batchJobs;
  }

  public GateDecision check(Mode mode) {
    List<String> unavailable = new ArrayList<>();
    for (LlmClient client : requiredModels) {
      if (!client.isAvailable()) {
        unavailable.add(client.modelId());
      }
    }
    if (!unavailable.isEmpty()) {
      log.warn("Run blocked, models unavailable: {}", unavailable);
      return GateDecision.modelUnavailable(unavailable);
    }

    List<BatchJob> inFlight = batchJobs.reconcile(mode);
    if (!inFlight.isEmpty()) {
      BatchJob job = inFlight.get(0);
      log.warn("Run blocked, batch job {} for mode {} is {}", job.jobId(), mode, job.status());
      return GateDecision.jobInProgress(mode, job.jobId());
    }
    return GateDecision.ready();
  }
}
