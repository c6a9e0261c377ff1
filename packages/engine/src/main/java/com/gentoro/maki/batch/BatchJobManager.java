package com.gentoro.maki.batch;

import com.gentoro.maki.classify.ClassificationParser;
import com.gentoro.maki.classify.ClassificationPrompt;
import com.gentoro.maki.event.EventRecord;
import com.gentoro.maki.exception.BatchJobException;
import com.gentoro.maki.exception.BatchJobTimeoutException;
import com.gentoro.maki.exception.ExceptionUtil;
import com.gentoro.maki.exception.MakiException;
import com.gentoro.maki.exception.NotFoundException;
import com.gentoro.maki.logging.LoggingService;
import com.gentoro.maki.mode.Mode;
import com.gentoro.maki.orchestrator.RunControl;
import com.gentoro.maki.result.AnalysisResult;
import com.gentoro.maki.result.ClassificationOutcome;
import com.gentoro.maki.result.ResultWriter;
import com.gentoro.maki.storage.ObjectStore;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;

/**
 * Drives one bulk classification job through its lifecycle: builds and stores the manifest, hands
 * it to the {@link BatchJobRunner}, polls until a terminal state, then matches the output back to
 * the events.
 *
 * <p>The job record is saved in {@code BUILDING} before anything else so that a concurrent run of
 * the same mode sees the lease as early as possible.
 */
public class BatchJobManager {
  private static final Logger log = LoggingService.getLogger(BatchJobManager.class);

  static final String TIMEOUT_MESSAGE = "timeout";

  private final BatchJobStore jobStore;
  private final BatchJobRunner runner;
  private final ObjectStore objectStore;
  private final ClassificationPrompt prompt;
  private final ClassificationParser parser;
  private final ResultWriter writer;
  private final long pollIntervalMs;
  private final long maxWaitMs;
  private final boolean cleanupIntermediate;
  private final Clock clock;

  public BatchJobManager(
      BatchJobStore jobStore,
      BatchJobRunner runner,
      ObjectStore objectStore,
      ClassificationPrompt prompt,
      ClassificationParser parser,
      ResultWriter writer,
      long pollIntervalMs,
      long maxWaitMs,
      boolean cleanupIntermediate,
      Clock clock) {
    this.jobStore = jobStore;
    this.runner = runner;
    this.objectStore = objectStore;
    this.prompt = prompt;
    this.parser = parser;
    this.writer = writer;
    this.pollIntervalMs = pollIntervalMs;
    this.maxWaitMs = maxWaitMs;
    this.cleanupIntermediate = cleanupIntermediate;
    this.clock = clock;
  }

  /**
   * Build the manifest for {@code events} and submit it.
   *
   * @return the job in {@code SUBMITTED}
   * @throws BatchJobException when building or submission fails; the job is recorded as FAILED
   */
  public BatchJob submit(Mode mode, List<EventRecord> events, String runId) {
    String jobId = mode.value() + "-" + runId;
    BatchJob job = BatchJob.building(jobId, mode, runId, events.size(), clock.instant());
    jobStore.save(job);
    try {
      List<BatchManifest.Entry> entries = new ArrayList<>(events.size());
      for (EventRecord event : events) {
        entries.add(
            new BatchManifest.Entry(
                event.id(), BatchManifest.ModelInput.of(prompt.render(event))));
      }
      objectStore.put(job.manifestRef(), BatchManifest.encode(entries));
      log.info("Wrote manifest {} with {} records", job.manifestRef(), entries.size());

      String runnerJobId = runner.submit(jobId, job.manifestRef(), job.outputRef());
      job = job.submitted(runnerJobId);
      jobStore.save(job);
      log.info("Submitted batch job {} (runner id {})", jobId, runnerJobId);
      return job;
    } catch (RuntimeException e) {
      jobStore.save(job.withStatus(BatchJobStatus.FAILED, ExceptionUtil.describe(e), clock.instant()));
      if (e instanceof BatchJobException bje) throw bje;
      throw new BatchJobException("Failed to submit batch job " + jobId, e);
    }
  }

  /** Refresh the job from the runner, saving it when its status changed. */
  public BatchJob poll(BatchJob job) {
    if (job.isTerminal() || job.runnerJobId() == null) {
      return job;
    }
    RunnerJobState state = runner.describe(job.runnerJobId());
    BatchJob next = job.withStatus(state.status(), state.message(), clock.instant());
    if (next != job) {
      jobStore.save(next);
      log.info("Batch job {} is now {}", next.jobId(), next.status());
    }
    return next;
  }

  /**
   * Poll until the job is terminal, sleeping {@code pollIntervalMs} between polls.
   *
   * @return the completed job
   * @throws BatchJobTimeoutException when {@code maxWaitMs} elapses first; the job is marked FAILED
   * @throws BatchJobException when the job ends FAILED or STOPPED
   * @throws com.gentoro.maki.exception.RunCancelledException on cancellation or run deadline; the
   *     job record stays non-terminal
   */
  public BatchJob awaitCompletion(BatchJob job, RunControl control) {
    long started = System.nanoTime();
    BatchJob current = job;
    while (true) {
      current = poll(current);
      if (current.isTerminal()) break;

      long waited = Duration.ofNanos(System.nanoTime() - started).toMillis();
      if (waited >= maxWaitMs) {
        jobStore.save(current.withStatus(BatchJobStatus.FAILED, TIMEOUT_MESSAGE, clock.instant()));
        stopQuietly(current);
        throw new BatchJobTimeoutException(current.jobId(), waited);
      }
      control.sleep(Math.min(pollIntervalMs, maxWaitMs - waited));
    }

    if (current.status() != BatchJobStatus.COMPLETED) {
      throw new BatchJobException(
          current.jobId(),
          "Batch job %s ended %s%s"
              .formatted(
                  current.jobId(),
                  current.status(),
                  current.statusMessage() == null ? "" : ": " + current.statusMessage()));
    }
    return current;
  }

  /**
   * Match runner output back to {@code events} and persist every parsed result. Missing, errored
   * or unparsable entries become per-event failures.
   *
   * @return one outcome per event, in event order
   */
  public List<ClassificationOutcome> fetch(BatchJob job, List<EventRecord> events) {
    Map<String, BatchManifest.OutputEntry> byId = new HashMap<>();
    String output = objectStore.get(job.outputRef()).orElse(null);
    if (output == null) {
      log.warn("Batch job {} produced no output object at {}", job.jobId(), job.outputRef());
    } else {
      for (BatchManifest.OutputEntry entry : BatchManifest.decodeOutput(output)) {
        if (entry.recordId() != null) byId.putIfAbsent(entry.recordId(), entry);
      }
    }

    List<ClassificationOutcome> outcomes = new ArrayList<>(events.size());
    for (EventRecord event : events) {
      BatchManifest.OutputEntry entry = byId.remove(event.id());
      outcomes.add(toOutcome(job, event, entry));
    }
    if (!byId.isEmpty()) {
      log.warn(
          "Batch job {} returned {} record(s) matching no event: {}",
          job.jobId(),
          byId.size(),
          byId.keySet());
    }
    return outcomes;
  }

  private ClassificationOutcome toOutcome(
      BatchJob job, EventRecord event, BatchManifest.OutputEntry entry) {
    if (entry == null) {
      return ClassificationOutcome.failure(event.id(), "missing from batch output");
    }
    if (entry.error() != null) {
      return ClassificationOutcome.failure(event.id(), entry.error());
    }
    if (entry.modelOutput() == null || entry.modelOutput().isBlank()) {
      return ClassificationOutcome.failure(event.id(), "empty model output");
    }
    try {
      AnalysisResult result = parser.parse(event, entry.modelOutput());
      writer.writeResult(job.runId(), ResultWriter.BATCH, result);
      return ClassificationOutcome.success(result);
    } catch (MakiException e) {
      log.debug("Batch record {} unusable: {}", event.id(), e.getMessage());
      return ClassificationOutcome.failure(event.id(), ExceptionUtil.describe(e));
    }
  }

  /** Remove the job's manifest and output objects, when enabled. */
  public void cleanup(BatchJob job) {
    if (!cleanupIntermediate) {
      log.debug("Keeping intermediate files of batch job {}", job.jobId());
      return;
    }
    int removed = objectStore.deletePrefix(BatchJob.prefix(job.jobId()));
    log.info("Removed {} intermediate object(s) of batch job {}", removed, job.jobId());
  }

  /**
   * Refresh every non-terminal job of {@code mode} from the runner so that finished or abandoned
   * jobs release the per-mode lease.
   *
   * @return jobs of {@code mode} still in flight
   */
  public List<BatchJob> reconcile(Mode mode) {
    List<BatchJob> inFlight = new ArrayList<>();
    for (BatchJob job : jobStore.findByMode(mode)) {
      if (job.isTerminal()) continue;
      BatchJob refreshed = refresh(job);
      if (!refreshed.isTerminal()) inFlight.add(refreshed);
    }
    return inFlight;
  }

  private BatchJob refresh(BatchJob job) {
    if (job.runnerJobId() == null) {
      // Still building; stale once older than the wait budget.
      Duration age = Duration.between(job.createdAt(), clock.instant());
      if (age.toMillis() > maxWaitMs) {
        BatchJob failed =
            job.withStatus(BatchJobStatus.FAILED, "abandoned while building", clock.instant());
        jobStore.save(failed);
        log.warn("Batch job {} was abandoned while building; marked FAILED", job.jobId());
        return failed;
      }
      return job;
    }
    try {
      return poll(job);
    } catch (NotFoundException e) {
      BatchJob failed =
          job.withStatus(BatchJobStatus.FAILED, "unknown to the job runner", clock.instant());
      jobStore.save(failed);
      log.warn("Batch job {} is unknown to the runner; marked FAILED", job.jobId());
      return failed;
    }
  }

  private void stopQuietly(BatchJob job) {
    try {
      runner.stop(job.runnerJobId());
    } catch (MakiException e) {
      log.warn("Could not stop timed out batch job {}: {}", job.jobId(), e.getMessage());
    }
  }
}
