package com.gentoro.maki.classify;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.maki.event.EventRecord;
import com.gentoro.maki.exception.ValidationException;
import com.gentoro.maki.logging.LoggingService;
import com.gentoro.maki.result.AnalysisResult;
import com.gentoro.maki.result.Sentiment;
import com.gentoro.maki.taxonomy.Taxonomy;
import com.gentoro.maki.utility.JacksonUtility;
import com.gentoro.maki.utility.StringUtility;
import java.io.IOException;
import org.slf4j.Logger;

/**
 * Turns a classification completion into an {@link AnalysisResult}. The category is always
 * normalised into the taxonomy; identifying fields come from the event, never from the model.
 */
public class ClassificationParser {
  private static final Logger log = LoggingService.getLogger(ClassificationParser.class);

  private final Taxonomy taxonomy;

  public ClassificationParser(Taxonomy taxonomy) {
    this.taxonomy = taxonomy;
  }

  /** @throws ValidationException when the completion holds no usable JSON object */
  public AnalysisResult parse(EventRecord event, String completion) {
    String json = StringUtility.extractJsonObject(completion);
    if (json == null) {
      throw new ValidationException(
          "Completion for event %s holds no JSON object: %s"
              .formatted(event.id(), StringUtility.truncate(completion, 200)));
    }
    JsonNode node;
    try {
      node = JacksonUtility.getJsonMapper().readTree(json);
    } catch (IOException e) {
      throw new ValidationException("Completion for event %s is not valid JSON".formatted(event.id()), e);
    }

    String proposed = text(node, "category");
    String category = taxonomy.normalize(proposed);
    if (proposed != null && !category.equalsIgnoreCase(proposed.trim())) {
      log.debug("Event {}: label '{}' mapped to '{}'", event.id(), proposed, category);
    }

    return new AnalysisResult(
        event.id(),
        event.mode(),
        event.identity(),
        category,
        text(node, "category_explanation"),
        firstText(node, "event_summary", "case_summary", "summary"),
        Sentiment.parse(text(node, "sentiment")),
        firstText(node, "suggested_action", "suggestion_action"),
        text(node, "suggestion_link"));
  }

  private static String firstText(JsonNode node, String... fields) {
    for (String f : fields) {
      String v = text(node, f);
      if (v != null) return v;
    }
    return null;
  }

  private static String text(JsonNode node, String field) {
    JsonNode v = node.get(field);
    if (v == null || v.isNull()) return null;
    String s = v.isTextual() ? v.asText() : v.toString();
    return s.isBlank() ? null : s.trim();
  }
}
