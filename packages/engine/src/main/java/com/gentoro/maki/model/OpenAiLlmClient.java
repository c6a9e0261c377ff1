package com.gentoro.maki.model;

import com.gentoro.maki.exception.LlmException;
import com.gentoro.maki.exception.StateException;
import com.gentoro.maki.exception.TransientInferenceException;
import com.gentoro.maki.logging.LoggingService;
import com.openai.client.OpenAIClient;
import com.openai.errors.InternalServerException;
import com.openai.errors.NotFoundException;
import com.openai.errors.OpenAIException;
import com.openai.errors.OpenAIIoException;
import com.openai.errors.PermissionDeniedException;
import com.openai.errors.RateLimitException;
import com.openai.errors.UnauthorizedException;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import com.openai.models.models.ModelRetrieveParams;
import java.util.List;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;

/** OpenAI implementation of {@link LlmClient} using openai-java SDK (Chat Completions API). */
public class OpenAiLlmClient extends AbstractLlmClient {
  private static final Logger log = LoggingService.getLogger(OpenAiLlmClient.class);
  private final OpenAIClient openAIClient;

  public OpenAiLlmClient(OpenAIClient openAIClient, Configuration configuration) {
    super(configuration);
    this.openAIClient = openAIClient;
  }

  @Override
  protected String runInference(List<Message> messages, InferenceEventListener listener) {
    ChatCompletionCreateParams.Builder builder =
        ChatCompletionCreateParams.builder().model(modelId());

    if (Message.contains(messages, Role.SYSTEM)) {
      builder.addSystemMessage(Message.findFirst(messages, Role.SYSTEM).content());
    }
    if (configuration.containsKey("temperature")) {
      builder.temperature(configuration.getDouble("temperature"));
    }
    if (configuration.containsKey("max-tokens")) {
      builder.maxCompletionTokens(configuration.getLong("max-tokens"));
    }

    Message.allExcept(messages, Role.SYSTEM)
        .forEach(
            message -> {
              if (message.role() == Role.ASSISTANT) {
                builder.addAssistantMessage(message.content());
              } else if (message.role() == Role.USER) {
                builder.addUserMessage(message.content());
              } else {
                throw new StateException("Unknown message role: " + message.role());
              }
            });

    long start = System.currentTimeMillis();
    ChatCompletion chatCompletion;
    try {
      chatCompletion = openAIClient.chat().completions().create(builder.build());
    } catch (RateLimitException | InternalServerException | OpenAIIoException e) {
      throw new TransientInferenceException(
          "OpenAI call on %s failed transiently: %s".formatted(modelId(), e.getMessage()), e);
    } catch (OpenAIException e) {
      throw new LlmException("OpenAI call on %s failed".formatted(modelId()), e);
    }
    listener.on(EventType.ON_COMPLETION, chatCompletion);

    if (chatCompletion.choices().isEmpty()) {
      throw new LlmException("OpenAI returned no choices for model " + modelId());
    }
    ChatCompletion.Choice choice = chatCompletion.choices().get(0);
    log.debug(
        "[Inference] OpenAI {} took {} ms, total tokens {}",
        modelId(),
        System.currentTimeMillis() - start,
        chatCompletion.usage().map(u -> String.valueOf(u.totalTokens())).orElse("n/a"));

    String result = choice.message().content().map(String::trim).orElse("");
    listener.on(EventType.ON_END, result);
    return result;
  }

  @Override
  public boolean isAvailable() {
    try {
      openAIClient.models().retrieve(ModelRetrieveParams.builder().model(modelId()).build());
      return true;
    } catch (UnauthorizedException | PermissionDeniedException | NotFoundException e) {
      log.warn("Model {} is not accessible: {}", modelId(), e.getMessage());
      return false;
    } catch (OpenAIException e) {
      log.warn("Availability probe for {} failed, assuming available: {}", modelId(), e.getMessage());
      return true;
    }
  }
}
