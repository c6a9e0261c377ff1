package com.gentoro.maki.model;

import java.util.List;

/**
 * Primary abstraction over a Large Language Model (LLM) backend.
 *
 * <p>Implementations encapsulate a provider SDK and expose a single-turn completion entry point
 * plus an availability probe used before a run commits any work. Concrete providers live behind
 * this interface and are selected via {@link LlmClientFactory} or the {@link
 * java.util.ServiceLoader} managed SPI {@link LlmClientProvider}.
 */
public interface LlmClient {

  /**
   * Run a single-turn completion.
   *
   * @param messages conversation, at most one {@link Role#SYSTEM} message
   * @param listener optional observer of provider events, may be null
   * @return trimmed completion text, never null
   * @throws com.gentoro.maki.exception.TransientInferenceException when the backend throttles or
   *     fails in a way that may succeed on retry
   * @throws com.gentoro.maki.exception.LlmException on any other inference failure
   */
  String chat(List<Message> messages, InferenceEventListener listener);

  default String chat(List<Message> messages) {
    return chat(messages, null);
  }

  /**
   * Whether the configured model can be invoked with the current credentials. Only an explicit
   * access or existence refusal reports false; other probe errors are treated as available.
   */
  boolean isAvailable();

  /** Identifier of the model this client calls. */
  String modelId();

  enum Role {
    SYSTEM,
    ASSISTANT,
    USER
  }

  record Message(Role role, String content) {
    public static Message system(String content) {
      return new Message(Role.SYSTEM, content);
    }

    public static Message user(String content) {
      return new Message(Role.USER, content);
    }

    static List<Message> allExcept(List<Message> messages, Role role) {
      return messages.stream().filter(m -> !m.role().equals(role)).toList();
    }

    static boolean contains(List<Message> messages, Role role) {
      return messages.stream().anyMatch(m -> m.role().equals(role));
    }

    static Message findFirst(List<Message> messages, Role role) {
      return messages.stream().filter(m -> m.role().equals(role)).findFirst().orElseThrow();
    }
  }

  enum EventType {
    ON_COMPLETION,
    ON_END
  }

  interface InferenceEventListener {
    void on(EventType type, Object data);
  }
}
