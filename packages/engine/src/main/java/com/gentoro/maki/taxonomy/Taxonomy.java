package com.gentoro.maki.taxonomy;

import com.gentoro.maki.exception.ConfigException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * The fixed, ordered set of categories events are classified into. The fallback label is always a
 * member; it is appended when the configured categories do not list it.
 */
public final class Taxonomy {
  static final String FALLBACK_DESCRIPTION =
      "The event does not match any of the other categories.";

  private final List<Category> categories;
  private final Map<String, Category> byKey;
  private final String fallback;

  public Taxonomy(List<Category> categories, String fallbackLabel) {
    if (fallbackLabel == null || fallbackLabel.isBlank()) {
      throw new ConfigException("Taxonomy fallback label must not be blank");
    }
    Map<String, Category> index = new LinkedHashMap<>();
    for (Category c : categories) {
      if (c.label() == null || c.label().isBlank()) {
        throw new ConfigException("Taxonomy contains a blank category label");
      }
      if (index.putIfAbsent(key(c.label()), c) != null) {
        throw new ConfigException("Duplicate taxonomy category: " + c.label());
      }
    }
    if (!index.containsKey(key(fallbackLabel))) {
      index.put(key(fallbackLabel), new Category(fallbackLabel.trim(), FALLBACK_DESCRIPTION, null));
    }
    if (index.size() < 2) {
      throw new ConfigException("Taxonomy needs at least one category besides the fallback");
    }
    this.byKey = Collections.unmodifiableMap(index);
    this.categories = List.copyOf(index.values());
    this.fallback = index.get(key(fallbackLabel)).label();
  }

  public List<Category> categories() {
    return categories;
  }

  public List<String> labels() {
    List<String> labels = new ArrayList<>(categories.size());
    categories.forEach(c -> labels.add(c.label()));
    return labels;
  }

  public String fallback() {
    return fallback;
  }

  public boolean contains(String label) {
    return label != null && byKey.containsKey(key(label));
  }

  /**
   * Canonical label for a model-proposed value. Matching ignores case, surrounding whitespace and
   * a leading list number such as {@code "3. "}; anything else maps to the fallback.
   */
  public String normalize(String proposed) {
    if (proposed == null) return fallback;
    String cleaned = proposed.trim().replaceFirst("^\\d+\\.\\s*", "");
    if (cleaned.endsWith(".")) cleaned = cleaned.substring(0, cleaned.length() - 1);
    Category c = byKey.get(key(cleaned));
    return c == null ? fallback : c.label();
  }

  private static String key(String label) {
    return label.trim().toLowerCase(Locale.ROOT);
  }
}
