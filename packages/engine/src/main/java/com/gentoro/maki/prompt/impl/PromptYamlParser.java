package com.gentoro.maki.prompt.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.maki.exception.ValidationException;
import com.gentoro.maki.model.LlmClient;
import com.gentoro.maki.prompt.PromptTemplate;
import com.gentoro.maki.utility.JacksonUtility;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/** Turns a sectioned prompt YAML document into a {@link PebblePromptTemplate}. */
final class PromptYamlParser {
  private PromptYamlParser() {}

  static PromptTemplate parse(String id, String yamlContent) throws IOException {
    JsonNode root = JacksonUtility.getYamlMapper().readTree(yamlContent);
    JsonNode arr = root == null ? null : root.get("sections");
    if (arr == null || !arr.isArray()) {
      throw new ValidationException("Prompt YAML must contain a 'sections' array: " + id);
    }

    List<PromptTemplate.PromptSection> sections = new ArrayList<>();
    for (JsonNode n : arr) {
      String roleStr = n.path("role").asText(null);
      if (roleStr == null) {
        throw new ValidationException("Missing role for a section in prompt: " + id);
      }
      LlmClient.Role role =
          switch (roleStr.toLowerCase(Locale.ROOT)) {
            case "user" -> LlmClient.Role.USER;
            case "assistant" -> LlmClient.Role.ASSISTANT;
            case "system" -> LlmClient.Role.SYSTEM;
            default -> throw new ValidationException(
                "Unknown role '" + roleStr + "' in prompt: " + id);
          };

      String sectionId = n.path("id").asText(null);
      if (sectionId == null || sectionId.isBlank()) {
        throw new ValidationException("Missing section id in prompt: " + id);
      }
      String content = n.path("content").asText("");
      if (content.isBlank()) {
        throw new ValidationException(
            "Empty content for section '" + sectionId + "' in prompt: " + id);
      }
      sections.add(
          new PromptTemplate.PromptSection(
              role, sectionId, n.path("enabled").asBoolean(true), content));
    }
    return new PebblePromptTemplate(id, sections);
  }
}
