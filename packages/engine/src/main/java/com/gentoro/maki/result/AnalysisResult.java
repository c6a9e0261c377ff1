package com.gentoro.maki.result;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.gentoro.maki.mode.Mode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Classification of one event, persisted as its own artifact. Every field is written, absent ones
 * as {@code null}.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record AnalysisResult(
    @JsonProperty("event_id") String eventId,
    @JsonProperty("mode") Mode mode,
    @JsonProperty("identity") Map<String, Object> identity,
    @JsonProperty("category") String category,
    @JsonProperty("category_explanation") String categoryExplanation,
    @JsonProperty("event_summary") String summary,
    @JsonProperty("sentiment") Sentiment sentiment,
    @JsonProperty("suggested_action") String suggestedAction,
    @JsonProperty("suggestion_link") String suggestionLink) {

  public AnalysisResult {
    identity =
        identity == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(identity));
    sentiment = sentiment == null ? Sentiment.NEUTRAL : sentiment;
  }
}
