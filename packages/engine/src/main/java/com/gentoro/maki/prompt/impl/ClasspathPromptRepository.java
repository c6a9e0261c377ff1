package com.gentoro.maki.prompt.impl;

import com.gentoro.maki.exception.ExceptionUtil;
import com.gentoro.maki.exception.NotFoundException;
import com.gentoro.maki.exception.PromptException;
import com.gentoro.maki.prompt.PromptRepository;
import com.gentoro.maki.prompt.PromptTemplate;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads prompt YAML templates from the classpath below a base directory, e.g. {@code prompts}
 * resolves {@code prompts/classify.yaml}. Parsed templates are cached since classpath content
 * cannot change at runtime.
 */
public class ClasspathPromptRepository implements PromptRepository {
  private final String basePath;
  private final ClassLoader classLoader;
  private final Map<String, PromptTemplate> cache = new ConcurrentHashMap<>();

  public ClasspathPromptRepository(String basePath) {
    this(basePath, Thread.currentThread().getContextClassLoader());
  }

  public ClasspathPromptRepository(String basePath, ClassLoader classLoader) {
    this.basePath = normalize(Objects.requireNonNull(basePath, "basePath"));
    this.classLoader =
        Objects.requireNonNullElseGet(
            classLoader, ClasspathPromptRepository.class::getClassLoader);
  }

  @Override
  public PromptTemplate get(String name) {
    String id = name.startsWith("/") ? name.substring(1) : name;
    return cache.computeIfAbsent(id, this::load);
  }

  private PromptTemplate load(String id) {
    String resource = resolveExisting(id);
    if (resource == null) {
      throw new NotFoundException("Prompt not found on classpath: " + id);
    }
    try (InputStream is = classLoader.getResourceAsStream(resource)) {
      if (is == null) {
        throw new NotFoundException("Prompt resource not found: " + resource);
      }
      return PromptYamlParser.parse(id, new String(is.readAllBytes(), StandardCharsets.UTF_8));
    } catch (Exception e) {
      throw ExceptionUtil.rethrowIfUnchecked(
          e, ex -> new PromptException("Failed to read prompt file: " + id, ex));
    }
  }

  private String resolveExisting(String id) {
    for (String ext : new String[] {".yaml", ".yml"}) {
      String candidate = basePath + "/" + id + ext;
      if (classLoader.getResource(candidate) != null) return candidate;
    }
    return null;
  }

  private static String normalize(String p) {
    String out = p.trim();
    if (out.startsWith("/")) out = out.substring(1);
    if (out.endsWith("/")) out = out.substring(0, out.length() - 1);
    return out;
  }
}
