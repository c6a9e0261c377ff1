package com.gentoro.maki.exception;

/** Prompt template loading or rendering failure. */
public class PromptException extends MakiException {
  public PromptException(String message) {
    super(MakiErrorCode.PROMPT_ERROR, message);
  }

  public PromptException(String message, Throwable cause) {
    super(MakiErrorCode.PROMPT_ERROR, message, cause);
  }
}
