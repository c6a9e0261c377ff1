package com.gentoro.maki.exception;

/** Errors raised while interacting with an LLM provider or interpreting its responses. */
public class LlmException extends MakiException {
  public LlmException(String message) {
    super(MakiErrorCode.LLM_ERROR, message);
  }

  public LlmException(String message, Throwable cause) {
    super(MakiErrorCode.LLM_ERROR, message, cause);
  }

  protected LlmException(MakiErrorCode code, String message, Throwable cause) {
    super(code, message, cause);
  }
}
