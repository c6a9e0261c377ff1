package com.gentoro.maki.exception;

/** Input validation failure or illegal argument. */
public class ValidationException extends MakiException {
  public ValidationException(String message) {
    super(MakiErrorCode.INVALID_ARGUMENT, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(MakiErrorCode.INVALID_ARGUMENT, message, cause);
  }
}
