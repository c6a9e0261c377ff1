package com.gentoro.maki.prompt;

/** Source of named prompt templates, e.g. {@code classify} or {@code aggregate}. */
public interface PromptRepository {

  /**
   * @throws com.gentoro.maki.exception.PromptException when the template is missing or malformed
   */
  PromptTemplate get(String name);
}
