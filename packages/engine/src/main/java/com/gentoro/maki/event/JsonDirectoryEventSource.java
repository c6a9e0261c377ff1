package com.gentoro.maki.event;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.maki.exception.IoException;
import com.gentoro.maki.exception.SerializationException;
import com.gentoro.maki.logging.LoggingService;
import com.gentoro.maki.utility.JacksonUtility;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;
import org.slf4j.Logger;

/**
 * Reads events from {@code *.json} (object or array) and {@code *.jsonl} files in one directory.
 * Files are read in name order; an event id seen twice keeps its first occurrence. A missing
 * directory yields no events.
 */
public abstract class JsonDirectoryEventSource<T extends EventRecord> implements EventSource {
  private static final Logger log = LoggingService.getLogger(JsonDirectoryEventSource.class);

  private final Path dir;
  private final Class<T> type;

  protected JsonDirectoryEventSource(Path dir, Class<T> type) {
    this.dir = dir;
    this.type = type;
  }

  public Path directory() {
    return dir;
  }

  @Override
  public long count() {
    return list().size();
  }

  @Override
  public List<EventRecord> list() {
    if (!Files.isDirectory(dir)) {
      log.warn("Event directory {} for mode {} does not exist", dir, mode());
      return List.of();
    }
    List<Path> files;
    try (Stream<Path> s = Files.list(dir)) {
      files =
          s.filter(Files::isRegularFile)
              .filter(p -> p.toString().endsWith(".json") || p.toString().endsWith(".jsonl"))
              .sorted()
              .toList();
    } catch (IOException e) {
      throw new IoException("Failed to list events in " + dir, e);
    }

    List<EventRecord> out = new ArrayList<>();
    Set<String> seen = new HashSet<>();
    for (Path file : files) {
      for (T event : read(file)) {
        if (event.id() == null || event.id().isBlank()) {
          log.warn("Skipping {} without an id in {}", type.getSimpleName(), file.getFileName());
        } else if (!seen.add(event.id())) {
          log.warn("Duplicate event id {} in {}; keeping the first", event.id(), file.getFileName());
        } else {
          out.add(event);
        }
      }
    }
    return out;
  }

  private List<T> read(Path file) {
    ObjectMapper mapper = JacksonUtility.getJsonMapper();
    List<T> events = new ArrayList<>();
    try {
      if (file.toString().endsWith(".jsonl")) {
        for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
          if (!line.isBlank()) events.add(mapper.readValue(line, type));
        }
      } else {
        JsonNode root = mapper.readTree(file.toFile());
        if (root.isArray()) {
          for (JsonNode n : root) events.add(mapper.treeToValue(n, type));
        } else {
          events.add(mapper.treeToValue(root, type));
        }
      }
    } catch (IOException e) {
      throw new SerializationException(
          "Failed to read %s records from %s".formatted(type.getSimpleName(), file), e);
    }
    return events;
  }
}
