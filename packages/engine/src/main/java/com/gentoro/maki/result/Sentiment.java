package com.gentoro.maki.result;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum Sentiment {
  POSITIVE("Positive"),
  NEGATIVE("Negative"),
  NEUTRAL("Neutral");

  private final String label;

  Sentiment(String label) {
    this.label = label;
  }

  @JsonValue
  public String label() {
    return label;
  }

  /** Lenient parse; anything unrecognised is {@link #NEUTRAL}. */
  @JsonCreator
  public static Sentiment parse(String raw) {
    if (raw == null) return NEUTRAL;
    String v = raw.trim().toLowerCase(Locale.ROOT);
    if (v.startsWith("pos")) return POSITIVE;
    if (v.startsWith("neg")) return NEGATIVE;
    return NEUTRAL;
  }
}
