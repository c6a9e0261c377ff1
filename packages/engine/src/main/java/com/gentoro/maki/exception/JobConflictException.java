package com.gentoro.maki.exception;

import java.util.Map;

/** A batch job for the same mode is still in flight. Resolves itself once that job terminates. */
public class JobConflictException extends MakiException {
  public JobConflictException(String mode, String jobId) {
    super(
        MakiErrorCode.ABORTED,
        "Batch job %s is still in progress for mode %s".formatted(jobId, mode),
        Map.of("mode", mode, "jobId", jobId));
  }
}
