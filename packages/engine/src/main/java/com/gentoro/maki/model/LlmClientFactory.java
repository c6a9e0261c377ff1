package com.gentoro.maki.model;

import com.gentoro.maki.exception.ConfigException;
import java.util.Locale;
import java.util.ServiceLoader;
import org.apache.commons.configuration2.Configuration;

/**
 * Creates {@link LlmClient} instances from named profiles under {@code llm.*}.
 *
 * <p>The engine uses two profiles: {@code light} for per-event classification and {@code heavy}
 * for synthesis.
 *
 * <pre>
 *   llm.light.provider = openai
 *   llm.light.apiKey   = ${env:OPENAI_API_KEY}
 *   llm.light.model    = gpt-4.1-mini
 * </pre>
 */
public final class LlmClientFactory {
  public static final String LIGHT = "light";
  public static final String HEAVY = "heavy";

  private LlmClientFactory() {}

  public static LlmClient createProvider(Configuration configuration, String profile) {
    String prefix = "llm." + profile;
    if (!configuration.getKeys(prefix).hasNext()) {
      throw new ConfigException("Missing %s configuration".formatted(prefix));
    }
    return create(configuration.subset(prefix), profile);
  }

  /** Creates a client from a profile subset which names at least its {@code provider}. */
  public static LlmClient create(Configuration subConfig, String profile) {
    String provider = subConfig.getString("provider", null);
    if (provider == null || provider.isBlank()) {
      throw new ConfigException("Missing llm.%s.provider".formatted(profile));
    }
    String id = provider.trim().toLowerCase(Locale.ROOT);
    for (LlmClientProvider p : ServiceLoader.load(LlmClientProvider.class)) {
      if (id.equals(p.providerId())) {
        return p.create(subConfig);
      }
    }
    throw new ConfigException("Unknown llm.%s.provider: %s".formatted(profile, provider));
  }
}
