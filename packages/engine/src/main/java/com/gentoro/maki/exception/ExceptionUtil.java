package com.gentoro.maki.exception;

import java.time.Instant;
import java.util.function.Function;

/** Utility helpers for dealing with exceptions and structured error details. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Convert any {@link Throwable} into {@link ErrorDetails} for logging or run outcomes. If the
   * throwable is a {@link MakiException}, its code and context are preserved.
   */
  public static ErrorDetails toErrorDetails(Throwable t) {
    if (t instanceof MakiException ex) {
      return new ErrorDetails(
          ex.getClass().getSimpleName(),
          safeMessage(ex.getMessage()),
          ex.getCode(),
          ex.getContext(),
          Instant.now());
    }
    return new ErrorDetails(
        t.getClass().getSimpleName(),
        safeMessage(t.getMessage()),
        MakiErrorCode.UNKNOWN,
        null,
        Instant.now());
  }

  /** Short "Type: message" rendering used for per-event error entries. */
  public static String describe(Throwable t) {
    if (t == null) return "";
    String message = t.getMessage();
    return message == null || message.isBlank()
        ? t.getClass().getSimpleName()
        : t.getClass().getSimpleName() + ": " + message;
  }

  private static String safeMessage(String message) {
    return message == null ? "" : message;
  }

  public static MakiException rethrowIfUnchecked(
      Throwable t, Function<Throwable, MakiException> supplier) {
    if (t instanceof MakiException) {
      return (MakiException) t;
    } else {
      return supplier.apply(t);
    }
  }
}
