package com.gentoro.maki.model;

import com.gentoro.maki.exception.ConfigException;
import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import java.time.Duration;
import org.apache.commons.configuration2.Configuration;

/** SPI provider for OpenAI-based {@link LlmClient} implementations. */
public final class OpenAiLlmClientProvider implements LlmClientProvider {

  @Override
  public String providerId() {
    return "openai";
  }

  @Override
  public LlmClient create(Configuration subConfiguration) {
    String apiKey = subConfiguration.getString("apiKey", null);
    if (apiKey == null || apiKey.isBlank()) {
      throw new ConfigException("Missing apiKey for the openai LLM profile");
    }
    OpenAIOkHttpClient.Builder builder =
        OpenAIOkHttpClient.builder()
            .apiKey(apiKey)
            .timeout(Duration.ofMillis(subConfiguration.getLong("timeout-ms", 120_000L)))
            // Retries are owned by the engine's retry policy.
            .maxRetries(0);
    String baseUrl = subConfiguration.getString("baseUrl", null);
    if (baseUrl != null && !baseUrl.isBlank()) {
      builder.baseUrl(baseUrl);
    }
    OpenAIClient client = builder.build();
    return new OpenAiLlmClient(client, subConfiguration);
  }
}
