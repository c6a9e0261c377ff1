package com.gentoro.maki.exception;

/** Illegal or unexpected state encountered. */
public class StateException extends MakiException {
  public StateException(String message) {
    super(MakiErrorCode.FAILED_PRECONDITION, message);
  }

  public StateException(String message, Throwable cause) {
    super(MakiErrorCode.FAILED_PRECONDITION, message, cause);
  }
}
