package com.gentoro.maki.exception;

/** File system or object store access failure. */
public class IoException extends MakiException {
  public IoException(String message) {
    super(MakiErrorCode.IO_ERROR, message);
  }

  public IoException(String message, Throwable cause) {
    super(MakiErrorCode.IO_ERROR, message, cause);
  }
}
