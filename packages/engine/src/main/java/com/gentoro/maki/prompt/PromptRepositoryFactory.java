package com.gentoro.maki.prompt;

import com.gentoro.maki.exception.ConfigException;
import com.gentoro.maki.prompt.impl.ClasspathPromptRepository;
import com.gentoro.maki.prompt.impl.FileSystemPromptRepository;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.Configuration;

public class PromptRepositoryFactory {
  public static final String DEFAULT_LOCATION = "classpath:prompts";

  private PromptRepositoryFactory() {}

  /**
   * Create a repository from the {@code prompt} configuration subset. {@code location} accepts
   * {@code classpath:prompts}, {@code file:/absolute/path} or a plain directory path and defaults
   * to the prompts bundled with the engine.
   */
  public static PromptRepository create(Configuration promptCfg) {
    String location =
        promptCfg == null ? null : promptCfg.getString("location", DEFAULT_LOCATION);
    if (location == null || location.isBlank()) {
      location = DEFAULT_LOCATION;
    }
    location = location.trim();

    if (location.startsWith("classpath:")) {
      String base = location.substring("classpath:".length());
      if (base.startsWith("/")) base = base.substring(1);
      if (base.isBlank()) {
        throw new ConfigException("Invalid prompt.location: classpath base path is empty");
      }
      return new ClasspathPromptRepository(base);
    }

    Path basePath;
    try {
      basePath = location.startsWith("file:") ? Path.of(URI.create(location)) : Path.of(location);
    } catch (IllegalArgumentException iae) {
      throw new ConfigException("Invalid prompt location URI/path: " + location, iae);
    }
    if (!Files.isDirectory(basePath)) {
      throw new ConfigException("Prompt directory does not exist: " + basePath);
    }
    return new FileSystemPromptRepository(basePath);
  }
}
