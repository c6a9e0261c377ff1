package com.gentoro.maki.batch;

import com.gentoro.maki.exception.BatchJobException;
import com.gentoro.maki.exception.ExceptionUtil;
import com.gentoro.maki.exception.NotFoundException;
import com.gentoro.maki.logging.LoggingService;
import com.gentoro.maki.model.LlmClient;
import com.gentoro.maki.storage.ObjectStore;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;

/**
 * In-process {@link BatchJobRunner}: each submitted manifest is processed on a background thread
 * by calling the given model once per entry, then the JSONL output is written to the object store.
 * Job state lives in memory, so jobs do not survive a restart.
 */
public class LocalBatchJobRunner implements BatchJobRunner, AutoCloseable {
  private static final Logger log = LoggingService.getLogger(LocalBatchJobRunner.class);

  private final ObjectStore store;
  private final LlmClient llm;
  private final int minRecords;
  private final ExecutorService executor;
  private final Map<String, LocalJob> jobs = new ConcurrentHashMap<>();

  private static final class LocalJob {
    final String name;
    volatile BatchJobStatus status = BatchJobStatus.SUBMITTED;
    volatile String message;
    volatile boolean stopRequested;

    LocalJob(String name) {
      this.name = name;
    }
  }

  public LocalBatchJobRunner(ObjectStore store, LlmClient llm, int minRecords) {
    this.store = store;
    this.llm = llm;
    this.minRecords = minRecords;
    this.executor =
        Executors.newSingleThreadExecutor(
            r -> {
              Thread t = new Thread(r, "maki-local-batch");
              t.setDaemon(true);
              return t;
            });
  }

  @Override
  public String submit(String jobName, String manifestRef, String outputRef) {
    String manifest =
        store
            .get(manifestRef)
            .orElseThrow(
                () -> new BatchJobException(jobName, "Manifest not found: " + manifestRef));
    List<BatchManifest.Entry> entries = BatchManifest.decodeInput(manifest);
    if (entries.size() < minRecords) {
      throw new BatchJobException(
          jobName,
          "Batch job needs at least %d records, got %d".formatted(minRecords, entries.size()));
    }

    String runnerJobId = "local-" + UUID.randomUUID();
    LocalJob job = new LocalJob(jobName);
    jobs.put(runnerJobId, job);
    executor.submit(() -> execute(runnerJobId, job, entries, outputRef));
    log.info("Accepted batch job {} as {} with {} records", jobName, runnerJobId, entries.size());
    return runnerJobId;
  }

  @Override
  public RunnerJobState describe(String runnerJobId) {
    LocalJob job = jobs.get(runnerJobId);
    if (job == null) {
      throw new NotFoundException("Unknown batch runner job: " + runnerJobId);
    }
    return new RunnerJobState(job.status, job.message);
  }

  @Override
  public void stop(String runnerJobId) {
    LocalJob job = jobs.get(runnerJobId);
    if (job == null) {
      throw new NotFoundException("Unknown batch runner job: " + runnerJobId);
    }
    job.stopRequested = true;
    log.info("Stop requested for batch job {} ({})", job.name, runnerJobId);
  }

  private void execute(
      String runnerJobId, LocalJob job, List<BatchManifest.Entry> entries, String outputRef) {
    if (job.stopRequested) {
      job.status = BatchJobStatus.STOPPED;
      return;
    }
    job.status = BatchJobStatus.IN_PROGRESS;
    try {
      List<BatchManifest.OutputEntry> out = new ArrayList<>(entries.size());
      for (BatchManifest.Entry entry : entries) {
        if (job.stopRequested) {
          job.status = BatchJobStatus.STOPPED;
          job.message = "Stopped after %d of %d records".formatted(out.size(), entries.size());
          return;
        }
        out.add(invoke(entry));
      }
      store.put(outputRef, BatchManifest.encode(out));
      job.status = BatchJobStatus.COMPLETED;
      log.info("Batch job {} ({}) completed {} records", job.name, runnerJobId, out.size());
    } catch (Exception e) {
      job.message = ExceptionUtil.describe(e);
      job.status = BatchJobStatus.FAILED;
      log.error("Batch job {} ({}) failed", job.name, runnerJobId, e);
    }
  }

  private BatchManifest.OutputEntry invoke(BatchManifest.Entry entry) {
    try {
      String completion = llm.chat(entry.modelInput().toMessages());
      return new BatchManifest.OutputEntry(entry.recordId(), entry.modelInput(), completion, null);
    } catch (RuntimeException e) {
      log.debug("Record {} failed: {}", entry.recordId(), e.getMessage());
      return new BatchManifest.OutputEntry(
          entry.recordId(), entry.modelInput(), null, ExceptionUtil.describe(e));
    }
  }

  @Override
  public void close() {
    executor.shutdownNow();
    try {
      if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
        log.warn("Local batch runner did not terminate within 5 seconds");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}
