package com.gentoro.maki.classify;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.maki.model.LlmClient;
import com.gentoro.maki.prompt.PromptRepositoryFactory;
import com.gentoro.maki.support.TestEvents;
import com.gentoro.maki.taxonomy.Category;
import com.gentoro.maki.taxonomy.Taxonomy;
import java.util.List;
import org.junit.jupiter.api.Test;

class ClassificationPromptTest {

  @Test
  void rendersTaxonomyContextAndEvent() {
    Taxonomy taxonomy =
        new Taxonomy(
            List.of(
                new Category(
                    "throttling",
                    "Requests rejected by rate limits.",
                    List.of("Rate exceeded on DescribeInstances")),
                new Category("feature-request", "", List.of())),
            "other");
    ClassificationPrompt prompt =
        new ClassificationPrompt(PromptRepositoryFactory.create(null), taxonomy);

    List<LlmClient.Message> messages = prompt.render(TestEvents.healthEvent("arn:aws:health:1"));

    assertEquals(2, messages.size());
    assertEquals(LlmClient.Role.SYSTEM, messages.get(0).role());
    String system = messages.get(0).content();
    assertTrue(system.contains("health event"));
    assertTrue(system.contains("1. throttling"));
    assertTrue(system.contains("3. other"));
    assertTrue(system.contains("Requests rejected by rate limits."));
    assertTrue(system.contains("Rate exceeded on DescribeInstances"));
    assertTrue(system.contains("\"suggestion_link\""));

    assertEquals(LlmClient.Role.USER, messages.get(1).role());
    assertTrue(messages.get(1).content().contains("arn:aws:health:1"));
    assertTrue(messages.get(1).content().contains("Increased API error rates"));
  }
}
