package com.gentoro.maki.model;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import com.openai.client.OpenAIClient;
import com.openai.errors.OpenAIException;
import com.openai.models.models.ModelRetrieveParams;
import com.openai.services.blocking.ModelService;
import org.apache.commons.configuration2.BaseConfiguration;
import org.apache.commons.configuration2.Configuration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("OpenAiLlmClient availability")
class OpenAiLlmClientTest {

  @Mock OpenAIClient openAIClient;
  @Mock ModelService models;

  private OpenAiLlmClient client;

  @BeforeEach
  void setUp() {
    Configuration cfg = new BaseConfiguration();
    cfg.setProperty("model", "gpt-4.1-mini");
    when(openAIClient.models()).thenReturn(models);
    client = new OpenAiLlmClient(openAIClient, cfg);
  }

  @Test
  @DisplayName("A model the API returns is available")
  void retrievableModelIsAvailable() {
    assertTrue(client.isAvailable());
    verify(models).retrieve(any(ModelRetrieveParams.class));
  }

  @Test
  @DisplayName("A failed lookup that is not a refusal keeps the model available")
  void lookupErrorKeepsModelAvailable() {
    when(models.retrieve(any(ModelRetrieveParams.class)))
        .thenThrow(new OpenAIException("connection reset"));

    assertTrue(client.isAvailable());
  }
}
