package com.gentoro.maki.classify;

import com.gentoro.maki.event.EventRecord;
import com.gentoro.maki.model.LlmClient;
import com.gentoro.maki.prompt.PromptRepository;
import com.gentoro.maki.prompt.PromptTemplate;
import com.gentoro.maki.taxonomy.Category;
import com.gentoro.maki.taxonomy.Taxonomy;
import com.gentoro.maki.utility.JacksonUtility;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders the {@code classify} prompt for one event. The system section carries the full taxonomy
 * context (labels, descriptions, exemplars) and the expected output shape; the user section
 * carries the event itself.
 */
public class ClassificationPrompt {
  public static final String TEMPLATE = "classify";

  static final String OUTPUT_FORMAT =
      """
      {
        "category": "<one category label>",
        "category_explanation": "<why this category was picked>",
        "event_summary": "<short summary of the event>",
        "sentiment": "Positive | Negative | Neutral",
        "suggested_action": "<how to fix the issue and prevent it from re-occurring>",
        "suggestion_link": "<documentation link supporting the suggested action>"
      }""";

  private final PromptRepository prompts;
  private final Taxonomy taxonomy;
  private final List<Map<String, Object>> categoryVars;

  public ClassificationPrompt(PromptRepository prompts, Taxonomy taxonomy) {
    this.prompts = prompts;
    this.taxonomy = taxonomy;
    this.categoryVars = new ArrayList<>();
    for (Category c : taxonomy.categories()) {
      Map<String, Object> m = new HashMap<>();
      m.put("label", c.label());
      m.put("description", c.description());
      m.put("examples", c.examples());
      categoryVars.add(m);
    }
  }

  public Taxonomy taxonomy() {
    return taxonomy;
  }

  public List<LlmClient.Message> render(EventRecord event) {
    Map<String, Object> eventFields = new LinkedHashMap<>(event.identity());
    eventFields.put("body", event.body());

    Map<String, Object> vars = new HashMap<>();
    vars.put("eventNoun", event.mode().eventNoun());
    vars.put("categories", categoryVars);
    vars.put("fallback", taxonomy.fallback());
    vars.put("outputFormat", OUTPUT_FORMAT);
    vars.put("event", JacksonUtility.toJson(eventFields));

    PromptTemplate template = prompts.get(TEMPLATE);
    return template.newSession().withDefaults(vars).renderMessages();
  }
}
