package com.gentoro.maki.mode;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.gentoro.maki.exception.ValidationException;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/** Which event source feeds the pipeline. */
public enum Mode {
  CASES("cases", "support case"),
  HEALTH("health", "health event");

  private final String value;
  private final String eventNoun;

  Mode(String value, String eventNoun) {
    this.value = value;
    this.eventNoun = eventNoun;
  }

  /** Persisted form, e.g. {@code cases}. */
  @JsonValue
  public String value() {
    return value;
  }

  /** Human wording for one event of this mode, used in prompts. */
  public String eventNoun() {
    return eventNoun;
  }

  public static Optional<Mode> fromValue(String raw) {
    if (raw == null) return Optional.empty();
    String v = raw.trim().toLowerCase(Locale.ROOT);
    return Arrays.stream(values()).filter(m -> m.value.equals(v)).findFirst();
  }

  @JsonCreator
  public static Mode parse(String raw) {
    return fromValue(raw).orElseThrow(() -> new ValidationException("Unknown mode: " + raw));
  }

  @Override
  public String toString() {
    return value;
  }
}
