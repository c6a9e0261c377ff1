package com.gentoro.maki.exception;

/**
 * Inference call failure that is worth retrying: throttling, timeouts, temporary backend errors.
 * Retried by {@link com.gentoro.maki.orchestrator.RetryPolicy}; any other {@link LlmException} is
 * final for the call that raised it.
 */
public class TransientInferenceException extends LlmException {
  public TransientInferenceException(String message) {
    super(MakiErrorCode.UNAVAILABLE, message, null);
  }

  public TransientInferenceException(String message, Throwable cause) {
    super(MakiErrorCode.UNAVAILABLE, message, cause);
  }
}
