package com.gentoro.maki.taxonomy;

import java.util.List;

/** One taxonomy label with its description and exemplar texts. */
public record Category(String label, String description, List<String> examples) {
  public Category {
    description = description == null ? "" : description.trim();
    examples = examples == null ? List.of() : List.copyOf(examples);
  }
}
