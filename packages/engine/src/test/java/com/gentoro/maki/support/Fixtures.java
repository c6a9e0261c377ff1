package com.gentoro.maki.support;

import com.gentoro.maki.classify.ClassificationParser;
import com.gentoro.maki.classify.ClassificationPrompt;
import com.gentoro.maki.prompt.PromptRepository;
import com.gentoro.maki.prompt.PromptRepositoryFactory;
import com.gentoro.maki.taxonomy.Category;
import com.gentoro.maki.taxonomy.Taxonomy;
import java.util.ArrayList;
import java.util.List;

/** Shared collaborators built from the bundled prompts and the test taxonomy. */
public final class Fixtures {
  private Fixtures() {}

  public static PromptRepository prompts() {
    return PromptRepositoryFactory.create(null);
  }

  public static Taxonomy taxonomy() {
    List<Category> categories = new ArrayList<>();
    for (String label : TestConfigs.CATEGORIES) {
      categories.add(new Category(label, "Events about " + label, List.of()));
    }
    return new Taxonomy(categories, "other");
  }

  public static ClassificationPrompt classificationPrompt() {
    return new ClassificationPrompt(prompts(), taxonomy());
  }

  public static ClassificationParser parser() {
    return new ClassificationParser(taxonomy());
  }
}
