package com.gentoro.maki.batch;

import com.gentoro.maki.mode.Mode;
import java.time.Instant;
import java.util.Objects;

/**
 * Persisted record of one bulk classification job. Changes only through {@link #withStatus} and
 * {@link #submitted}; terminal states are never left.
 */
public record BatchJob(
    String jobId,
    Mode mode,
    String runId,
    BatchJobStatus status,
    String manifestRef,
    String outputRef,
    String runnerJobId,
    int recordCount,
    Instant createdAt,
    Instant completedAt,
    String statusMessage) {

  public static BatchJob building(
      String jobId, Mode mode, String runId, int recordCount, Instant now) {
    return new BatchJob(
        jobId,
        mode,
        runId,
        BatchJobStatus.BUILDING,
        manifestKey(jobId),
        outputKey(jobId),
        null,
        recordCount,
        now,
        null,
        null);
  }

  public static String prefix(String jobId) {
    return "batch/" + jobId + "/";
  }

  public static String manifestKey(String jobId) {
    return prefix(jobId) + "input/manifest.jsonl";
  }

  public static String outputKey(String jobId) {
    return prefix(jobId) + "output/manifest.jsonl.out";
  }

  public boolean isTerminal() {
    return status.isTerminal();
  }

  public BatchJob submitted(String runnerJobId) {
    return new BatchJob(
        jobId,
        mode,
        runId,
        BatchJobStatus.SUBMITTED,
        manifestRef,
        outputRef,
        runnerJobId,
        recordCount,
        createdAt,
        null,
        null);
  }

  /** A terminal job is returned unchanged. */
  public BatchJob withStatus(BatchJobStatus next, String message, Instant now) {
    if (isTerminal() || (next == status && Objects.equals(message, statusMessage))) {
      return this;
    }
    return new BatchJob(
        jobId,
        mode,
        runId,
        next,
        manifestRef,
        outputRef,
        runnerJobId,
        recordCount,
        createdAt,
        next.isTerminal() ? now : null,
        message);
  }
}
