package com.gentoro.maki.prompt.impl;

import com.gentoro.maki.exception.ExceptionUtil;
import com.gentoro.maki.exception.NotFoundException;
import com.gentoro.maki.exception.PromptException;
import com.gentoro.maki.prompt.PromptRepository;
import com.gentoro.maki.prompt.PromptTemplate;
import java.nio.file.Files;
import java.nio.file.Path;

/** Reads prompt YAML files from a directory on every lookup so edits apply to the next run. */
public class FileSystemPromptRepository implements PromptRepository {
  private final Path path;

  public FileSystemPromptRepository(Path path) {
    this.path = path;
  }

  @Override
  public PromptTemplate get(String name) {
    String id = name.startsWith("/") ? name.substring(1) : name;
    Path yamlPath = resolveExisting(id);
    if (yamlPath == null) {
      throw new NotFoundException("Prompt not found: " + path.resolve(id));
    }
    try {
      return PromptYamlParser.parse(id, Files.readString(yamlPath));
    } catch (Exception e) {
      throw ExceptionUtil.rethrowIfUnchecked(
          e, ex -> new PromptException("Failed to read prompt file: " + yamlPath, ex));
    }
  }

  private Path resolveExisting(String id) {
    Path pYaml = path.resolve(id + ".yaml");
    if (Files.exists(pYaml)) return pYaml;
    Path pYml = path.resolve(id + ".yml");
    if (Files.exists(pYml)) return pYml;
    return null;
  }
}
