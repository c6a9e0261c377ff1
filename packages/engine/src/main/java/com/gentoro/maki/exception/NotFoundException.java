package com.gentoro.maki.exception;

/** Resource requested was not found. */
public class NotFoundException extends MakiException {
  public NotFoundException(String message) {
    super(MakiErrorCode.NOT_FOUND, message);
  }

  public NotFoundException(String message, Throwable cause) {
    super(MakiErrorCode.NOT_FOUND, message, cause);
  }
}
