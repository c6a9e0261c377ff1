package com.gentoro.maki.taxonomy;

import com.gentoro.maki.exception.ConfigException;
import com.gentoro.maki.exception.IoException;
import com.gentoro.maki.logging.LoggingService;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;

/**
 * Builds the {@link Taxonomy} from configuration.
 *
 * <p>Labels come from {@code taxonomy.categories} in order, the fallback from {@code
 * taxonomy.fallback}. When {@code taxonomy.dir} is set, each label may have {@code
 * <label>/description.txt} and exemplar files under {@code <label>/examples/}.
 */
public class TaxonomyLoader {
  private static final Logger log = LoggingService.getLogger(TaxonomyLoader.class);

  public static final String DEFAULT_FALLBACK = "other";

  private final Configuration configuration;

  public TaxonomyLoader(Configuration configuration) {
    this.configuration = configuration;
  }

  public Taxonomy load() {
    List<String> labels = configuration.getList(String.class, "taxonomy.categories", List.of());
    if (labels.isEmpty()) {
      throw new ConfigException("taxonomy.categories must list at least one category");
    }
    String dir = configuration.getString("taxonomy.dir", null);
    Path root = dir == null || dir.isBlank() ? null : Path.of(dir);
    if (root != null && !Files.isDirectory(root)) {
      log.warn("Taxonomy directory {} does not exist; categories carry labels only", root);
      root = null;
    }

    List<Category> categories = new ArrayList<>();
    for (String label : labels) {
      String trimmed = label.trim();
      if (root == null) {
        categories.add(new Category(trimmed, "", List.of()));
      } else {
        Path categoryDir = root.resolve(trimmed);
        categories.add(
            new Category(
                trimmed,
                readIfPresent(categoryDir.resolve("description.txt")),
                readExamples(categoryDir.resolve("examples"))));
      }
    }
    Taxonomy taxonomy =
        new Taxonomy(categories, configuration.getString("taxonomy.fallback", DEFAULT_FALLBACK));
    log.info(
        "Loaded taxonomy with {} categories (fallback '{}')",
        taxonomy.categories().size(),
        taxonomy.fallback());
    return taxonomy;
  }

  private static String readIfPresent(Path file) {
    if (!Files.isRegularFile(file)) return "";
    try {
      return Files.readString(file, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new IoException("Failed to read category description " + file, e);
    }
  }

  private static List<String> readExamples(Path dir) {
    if (!Files.isDirectory(dir)) return List.of();
    List<String> examples = new ArrayList<>();
    try (Stream<Path> files = Files.list(dir)) {
      for (Path f : files.filter(Files::isRegularFile).sorted().toList()) {
        String text = Files.readString(f, StandardCharsets.UTF_8).trim();
        if (!text.isEmpty()) examples.add(text);
      }
    } catch (IOException e) {
      throw new IoException("Failed to read category examples in " + dir, e);
    }
    return examples;
  }
}
