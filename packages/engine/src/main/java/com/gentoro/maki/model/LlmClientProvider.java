package com.gentoro.maki.model;

import org.apache.commons.configuration2.Configuration;

/**
 * Service Provider Interface (SPI) for pluggable LLM providers.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader} and identify themselves
 * with a stable {@code providerId}. To register a provider, add its fully qualified class name to
 * {@code META-INF/services/com.gentoro.maki.model.LlmClientProvider}.
 */
public interface LlmClientProvider {

  /** A stable, lowercase identifier for this provider (e.g. "openai"). */
  String providerId();

  /**
   * Creates a configured {@link LlmClient}.
   *
   * @param subConfiguration profile configuration subset (e.g. {@code llm.light.*})
   * @throws com.gentoro.maki.exception.ConfigException when required keys are missing
   */
  LlmClient create(Configuration subConfiguration);
}
