package com.gentoro.maki.exception;

/** Configuration or environment related problem detected at startup or runtime. */
public class ConfigException extends MakiException {
  public ConfigException(String message) {
    super(MakiErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(MakiErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
