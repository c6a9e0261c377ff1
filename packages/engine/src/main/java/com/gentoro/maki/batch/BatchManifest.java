package com.gentoro.maki.batch;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.gentoro.maki.exception.SerializationException;
import com.gentoro.maki.logging.LoggingService;
import com.gentoro.maki.model.LlmClient;
import com.gentoro.maki.utility.JacksonUtility;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;

/**
 * JSONL codec for batch manifests. Input lines carry {@code recordId} and {@code modelInput};
 * output lines add either {@code modelOutput} or {@code error}.
 */
public final class BatchManifest {
  private static final Logger log = LoggingService.getLogger(BatchManifest.class);

  private BatchManifest() {}

  /** Rendered prompt of one request. */
  public record ModelInput(String system, String user) {
    public static ModelInput of(List<LlmClient.Message> messages) {
      StringBuilder system = new StringBuilder();
      StringBuilder user = new StringBuilder();
      for (LlmClient.Message m : messages) {
        StringBuilder target = m.role() == LlmClient.Role.SYSTEM ? system : user;
        if (target.length() > 0) target.append("\n\n");
        target.append(m.content());
      }
      return new ModelInput(system.toString(), user.toString());
    }

    public List<LlmClient.Message> toMessages() {
      List<LlmClient.Message> out = new ArrayList<>(2);
      if (system != null && !system.isBlank()) out.add(LlmClient.Message.system(system));
      out.add(LlmClient.Message.user(user == null ? "" : user));
      return out;
    }
  }

  public record Entry(String recordId, ModelInput modelInput) {}

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record OutputEntry(
      String recordId, ModelInput modelInput, String modelOutput, String error) {}

  public static String encode(List<?> lines) {
    StringBuilder sb = new StringBuilder();
    for (Object line : lines) {
      sb.append(JacksonUtility.toJsonLine(line)).append('\n');
    }
    return sb.toString();
  }

  /** @throws SerializationException on the first malformed line */
  public static List<Entry> decodeInput(String jsonl) {
    List<Entry> out = new ArrayList<>();
    int n = 0;
    for (String line : jsonl.split("\n")) {
      n++;
      if (line.isBlank()) continue;
      try {
        out.add(JacksonUtility.fromJson(line, Entry.class));
      } catch (SerializationException e) {
        throw new SerializationException("Malformed manifest line " + n, e);
      }
    }
    return out;
  }

  /** Malformed output lines are logged and skipped. */
  public static List<OutputEntry> decodeOutput(String jsonl) {
    List<OutputEntry> out = new ArrayList<>();
    int n = 0;
    for (String line : jsonl.split("\n")) {
      n++;
      if (line.isBlank()) continue;
      try {
        out.add(JacksonUtility.fromJson(line, OutputEntry.class));
      } catch (SerializationException e) {
        log.warn("Skipping malformed batch output line {}: {}", n, e.getMessage());
      }
    }
    return out;
  }
}
