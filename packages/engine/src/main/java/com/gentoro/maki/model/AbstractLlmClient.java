package com.gentoro.maki.model;

import com.gentoro.maki.exception.ExceptionUtil;
import com.gentoro.maki.exception.LlmException;
import com.gentoro.maki.logging.LoggingService;
import java.util.List;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;

/**
 * Base {@link LlmClient} with the common plumbing: timing, trace logging and wrapping of
 * unexpected provider errors into {@link LlmException}.
 *
 * <p>Subclasses implement {@link #runInference(List, InferenceEventListener)} for a single turn
 * with a concrete provider SDK. Profile settings read here:
 *
 * <ul>
 *   <li>{@code model} (string, required)
 *   <li>{@code temperature} (double, optional)
 *   <li>{@code max-tokens} (long, optional)
 * </ul>
 */
public abstract class AbstractLlmClient implements LlmClient {
  private static final Logger log = LoggingService.getLogger(AbstractLlmClient.class);

  private static final InferenceEventListener NO_OP = (type, data) -> {};

  protected final Configuration configuration;
  private final String modelId;

  protected AbstractLlmClient(Configuration configuration) {
    this.configuration = configuration;
    String model = configuration.getString("model", null);
    if (model == null || model.isBlank()) {
      throw new LlmException("Missing 'model' in LLM profile configuration");
    }
    this.modelId = model.trim();
  }

  @Override
  public String modelId() {
    return modelId;
  }

  @Override
  public String chat(List<Message> messages, InferenceEventListener listener) {
    if (messages == null || messages.isEmpty()) {
      throw new LlmException("At least one message is required");
    }
    log.trace("chat() called with {} message(s) on model {}", messages.size(), modelId);
    long start = System.currentTimeMillis();
    try {
      String content = runInference(messages, listener == null ? NO_OP : listener);
      return content == null ? "" : content.trim();
    } catch (Exception e) {
      throw ExceptionUtil.rethrowIfUnchecked(
          e,
          ex ->
              new LlmException(
                  "There was a problem while running the inference with model " + modelId, ex));
    } finally {
      log.debug("Inference on {} took {} ms", modelId, System.currentTimeMillis() - start);
    }
  }

  protected abstract String runInference(List<Message> messages, InferenceEventListener listener);
}
