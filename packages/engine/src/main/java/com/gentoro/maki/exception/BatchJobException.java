package com.gentoro.maki.exception;

import java.util.Map;

/** The batch job runner reported failure or stop for a job; the whole run fails. */
public class BatchJobException extends MakiException {
  public BatchJobException(String jobId, String message) {
    super(MakiErrorCode.BATCH_JOB_ERROR, message, Map.of("jobId", jobId));
  }

  public BatchJobException(String message, Throwable cause) {
    super(MakiErrorCode.BATCH_JOB_ERROR, message, cause);
  }

  protected BatchJobException(MakiErrorCode code, String jobId, String message) {
    super(code, message, Map.of("jobId", jobId));
  }
}
