package com.gentoro.maki.exception;

/** JSON/YAML serialization or deserialization error. */
public class SerializationException extends MakiException {
  public SerializationException(String message) {
    super(MakiErrorCode.SERIALIZATION_ERROR, message);
  }

  public SerializationException(String message, Throwable cause) {
    super(MakiErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}
