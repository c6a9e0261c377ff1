package com.gentoro.maki.exception;

/**
 * Polling exceeded the wait budget before the batch job reached a terminal state. Reported with
 * the same code as any other batch job failure.
 */
public class BatchJobTimeoutException extends BatchJobException {
  public BatchJobTimeoutException(String jobId, long waitedMs) {
    super(
        MakiErrorCode.BATCH_JOB_ERROR,
        jobId,
        "Batch job %s did not finish within %d ms".formatted(jobId, waitedMs));
  }
}
