package com.gentoro.maki.prompt.impl;

import com.gentoro.maki.exception.PromptException;
import com.gentoro.maki.model.LlmClient;
import com.gentoro.maki.prompt.PromptTemplate;
import io.pebbletemplates.pebble.PebbleEngine;
import io.pebbletemplates.pebble.extension.AbstractExtension;
import io.pebbletemplates.pebble.extension.Function;
import io.pebbletemplates.pebble.template.PebbleTemplate;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Pebble-based implementation of an immutable PromptTemplate definition. Rendering state is
 * isolated in PromptSession instances.
 */
public class PebblePromptTemplate implements PromptTemplate {
  // Prompts carry raw event text and JSON; HTML escaping would corrupt both.
  private static final PebbleEngine ENGINE =
      new PebbleEngine.Builder()
          .strictVariables(true)
          .autoEscaping(false)
          .extension(
              new AbstractExtension() {
                @Override
                public Map<String, Function> getFunctions() {
                  return Map.of("ident", new IdentFunction());
                }
              })
          .build();

  private final String id;
  private final List<PromptSection> sections;
  private final List<PebbleTemplate> compiled;

  public PebblePromptTemplate(String id, List<PromptSection> sections) {
    this.id = Objects.requireNonNull(id, "id");
    this.sections = List.copyOf(Objects.requireNonNull(sections, "sections"));
    this.compiled =
        this.sections.stream().map(s -> ENGINE.getLiteralTemplate(s.content())).toList();
  }

  @Override
  public String id() {
    return id;
  }

  @Override
  public List<PromptSection> sections() {
    return sections;
  }

  @Override
  public PromptSession newSession() {
    return new Session();
  }

  private class Session implements PromptSession {
    private final Map<String, Map<String, Object>> enabled = new LinkedHashMap<>();

    Session() {
      for (PromptSection s : sections) {
        if (s.enabledByDefault()) {
          enabled.put(s.id(), new HashMap<>());
        }
      }
    }

    @Override
    public PromptSession enable(String sectionId, Map<String, Object> vars) {
      enabled.put(sectionId, vars != null ? new HashMap<>(vars) : new HashMap<>());
      return this;
    }

    @Override
    public PromptSession disable(String... sectionIds) {
      if (sectionIds != null) {
        for (String sectionId : sectionIds) {
          enabled.remove(sectionId);
        }
      }
      return this;
    }

    @Override
    public PromptSession withDefaults(Map<String, Object> vars) {
      enabled.values().forEach(v -> v.putAll(vars));
      return this;
    }

    @Override
    public List<LlmClient.Message> renderMessages() {
      List<LlmClient.Message> out = new ArrayList<>();
      for (int i = 0; i < sections.size(); i++) {
        PromptSection s = sections.get(i);
        Map<String, Object> ctx = enabled.get(s.id());
        if (ctx == null) continue;
        try {
          StringWriter writer = new StringWriter();
          compiled.get(i).evaluate(writer, ctx);
          out.add(new LlmClient.Message(s.role(), writer.toString().trim()));
        } catch (Exception e) {
          throw new PromptException(
              "Failed to render prompt section '" + s.id() + "' in template '" + id + "'", e);
        }
      }
      return out;
    }
  }
}
