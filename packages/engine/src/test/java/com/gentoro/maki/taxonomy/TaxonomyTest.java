package com.gentoro.maki.taxonomy;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.maki.exception.ConfigException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.apache.commons.configuration2.BaseConfiguration;
import org.apache.commons.configuration2.Configuration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TaxonomyTest {

  @TempDir Path dir;

  private static Category c(String label) {
    return new Category(label, "", List.of());
  }

  @Test
  @DisplayName("Fallback is appended when not listed")
  void fallbackIsMember() {
    Taxonomy t = new Taxonomy(List.of(c("throttling"), c("limit-reached")), "other");

    assertEquals(List.of("throttling", "limit-reached", "other"), t.labels());
    assertTrue(t.contains("OTHER"));
    assertEquals("other", t.fallback());
  }

  @Test
  void normalizeMatchesLeniently() {
    Taxonomy t = new Taxonomy(List.of(c("throttling"), c("other")), "other");

    assertEquals("throttling", t.normalize(" Throttling "));
    assertEquals("throttling", t.normalize("2. throttling."));
    assertEquals("other", t.normalize("networking"));
    assertEquals("other", t.normalize(null));
  }

  @Test
  void invalidTaxonomiesAreRejected() {
    assertThrows(ConfigException.class, () -> new Taxonomy(List.of(c("a"), c("A")), "other"));
    assertThrows(ConfigException.class, () -> new Taxonomy(List.of(c("other")), "other"));
    assertThrows(ConfigException.class, () -> new Taxonomy(List.of(c("a")), " "));
  }

  @Test
  @DisplayName("Loader reads descriptions and examples from the category directory")
  void loaderReadsCategoryDirectory() throws Exception {
    Path examples = Files.createDirectories(dir.resolve("throttling/examples"));
    Files.writeString(dir.resolve("throttling/description.txt"), "Rate limits hit.");
    Files.writeString(examples.resolve("b.txt"), "second");
    Files.writeString(examples.resolve("a.txt"), "first");
    Configuration cfg = new BaseConfiguration();
    cfg.setProperty("taxonomy.categories", List.of("throttling", "feature-request"));
    cfg.setProperty("taxonomy.dir", dir.toString());

    Taxonomy t = new TaxonomyLoader(cfg).load();

    assertEquals(List.of("throttling", "feature-request", "other"), t.labels());
    Category throttling = t.categories().get(0);
    assertEquals("Rate limits hit.", throttling.description());
    assertEquals(List.of("first", "second"), throttling.examples());
    assertEquals("", t.categories().get(1).description());
  }

  @Test
  void loaderRequiresCategories() {
    assertThrows(ConfigException.class, () -> new TaxonomyLoader(new BaseConfiguration()).load());
  }
}
