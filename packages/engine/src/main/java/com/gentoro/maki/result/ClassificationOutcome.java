package com.gentoro.maki.result;

/** Per-event fan-in unit: either a result or the error that prevented one. */
public record ClassificationOutcome(String eventId, AnalysisResult result, String error) {

  public static ClassificationOutcome success(AnalysisResult result) {
    return new ClassificationOutcome(result.eventId(), result, null);
  }

  public static ClassificationOutcome failure(String eventId, String error) {
    return new ClassificationOutcome(eventId, null, error);
  }

  public boolean isSuccess() {
    return result != null;
  }
}
