package com.gentoro.maki.exception;

import java.time.Instant;
import java.util.Map;

/** Lightweight DTO to expose structured error information to logs and run outcomes. */
public final class ErrorDetails {
  public final String type;
  public final String message;
  public final MakiErrorCode code;
  public final Map<String, Object> context;
  public final Instant timestamp;

  public ErrorDetails(
      String type,
      String message,
      MakiErrorCode code,
      Map<String, Object> context,
      Instant timestamp) {
    this.type = type;
    this.message = message;
    this.code = code;
    this.context = context;
    this.timestamp = timestamp;
  }
}
