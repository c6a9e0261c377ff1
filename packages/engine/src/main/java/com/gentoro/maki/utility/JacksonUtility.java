package com.gentoro.maki.utility;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.gentoro.maki.exception.SerializationException;

public class JacksonUtility {
  private static final ObjectMapper YAML_MAPPER =
      new ObjectMapper(
          new YAMLFactory()
              .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
              .enable(YAMLGenerator.Feature.LITERAL_BLOCK_STYLE)
              .disable(YAMLGenerator.Feature.SPLIT_LINES)
              .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES));

  private static final ObjectMapper JSON_MAPPER =
      new ObjectMapper()
          .registerModule(new JavaTimeModule())
          .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
          .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false)
          .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
          .enable(SerializationFeature.INDENT_OUTPUT)
          .setSerializationInclusion(JsonInclude.Include.NON_NULL);

  // JSONL lines must stay on one line.
  private static final ObjectMapper JSONL_MAPPER =
      JSON_MAPPER.copy().disable(SerializationFeature.INDENT_OUTPUT);

  public static ObjectMapper getYamlMapper() {
    return YAML_MAPPER;
  }

  public static ObjectMapper getJsonMapper() {
    return JSON_MAPPER;
  }

  public static String toJson(Object object) {
    try {
      return JSON_MAPPER.writeValueAsString(object);
    } catch (Exception e) {
      throw new SerializationException("Failed to serialize object to JSON", e);
    }
  }

  public static String toJsonLine(Object object) {
    try {
      return JSONL_MAPPER.writeValueAsString(object);
    } catch (Exception e) {
      throw new SerializationException("Failed to serialize object to a JSON line", e);
    }
  }

  public static <T> T fromJson(String json, Class<T> type) {
    try {
      return JSON_MAPPER.readValue(json, type);
    } catch (Exception e) {
      throw new SerializationException(
          "Failed to read %s from JSON".formatted(type.getSimpleName()), e);
    }
  }
}
