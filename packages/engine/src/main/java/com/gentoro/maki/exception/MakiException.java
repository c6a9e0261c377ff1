package com.gentoro.maki.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Base runtime exception for MAKI with a stable {@link MakiErrorCode} and optional context.
 *
 * <p>The context map is copied and unmodifiable. Subclasses pin the code so that callers only pick
 * the exception type.
 */
public class MakiException extends RuntimeException {
  private final MakiErrorCode code;
  private final Map<String, Object> context;

  public MakiException(MakiErrorCode code, String message) {
    super(message);
    this.code = Objects.requireNonNull(code, "code");
    this.context = Collections.emptyMap();
  }

  public MakiException(MakiErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = Objects.requireNonNull(code, "code");
    this.context = Collections.emptyMap();
  }

  public MakiException(MakiErrorCode code, String message, Map<String, ?> context) {
    super(message);
    this.code = Objects.requireNonNull(code, "code");
    this.context = copy(context);
  }

  public MakiException(
      MakiErrorCode code, String message, Map<String, ?> context, Throwable cause) {
    super(message, cause);
    this.code = Objects.requireNonNull(code, "code");
    this.context = copy(context);
  }

  public MakiErrorCode getCode() {
    return code;
  }

  /** Additional key/value details that help diagnosing the error. */
  public Map<String, Object> getContext() {
    return context;
  }

  private static Map<String, Object> copy(Map<String, ?> input) {
    if (input == null || input.isEmpty()) return Collections.emptyMap();
    Map<String, Object> m = new LinkedHashMap<>();
    input.forEach(m::put);
    return Collections.unmodifiableMap(m);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName()
        + "{"
        + "code="
        + code
        + ", message="
        + getMessage()
        + (context.isEmpty() ? "" : ", context=" + context)
        + (getCause() == null ? "" : ", cause=" + getCause().getClass().getSimpleName())
        + '}';
  }
}
