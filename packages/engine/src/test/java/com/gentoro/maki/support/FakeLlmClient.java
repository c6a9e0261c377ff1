package com.gentoro.maki.support;

import com.gentoro.maki.model.LlmClient;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/** Deterministic in-memory model used across tests. */
public class FakeLlmClient implements LlmClient {
  private final String modelId;
  private final Function<List<Message>, String> responder;
  private volatile boolean available = true;
  private final AtomicInteger calls = new AtomicInteger();
  private final AtomicInteger inFlight = new AtomicInteger();
  private final AtomicInteger maxInFlight = new AtomicInteger();
  private volatile long latencyMs;

  public FakeLlmClient(String modelId, Function<List<Message>, String> responder) {
    this.modelId = modelId;
    this.responder = responder;
  }

  public FakeLlmClient available(boolean available) {
    this.available = available;
    return this;
  }

  public FakeLlmClient latency(long latencyMs) {
    this.latencyMs = latencyMs;
    return this;
  }

  public int calls() {
    return calls.get();
  }

  public int maxInFlight() {
    return maxInFlight.get();
  }

  @Override
  public String chat(List<Message> messages, InferenceEventListener listener) {
    calls.incrementAndGet();
    int now = inFlight.incrementAndGet();
    maxInFlight.accumulateAndGet(now, Math::max);
    try {
      if (latencyMs > 0) {
        Thread.sleep(latencyMs);
      }
      return responder.apply(messages);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException(e);
    } finally {
      inFlight.decrementAndGet();
    }
  }

  @Override
  public boolean isAvailable() {
    return available;
  }

  @Override
  public String modelId() {
    return modelId;
  }

  /** Text of the last user message. */
  public static String userText(List<Message> messages) {
    String out = "";
    for (Message m : messages) {
      if (m.role() == Role.USER) out = m.content();
    }
    return out;
  }

  /** A classification reply in the shape the classify prompt asks for. */
  public static String classification(String category, String sentiment) {
    return """
        Here is the result:
        ```json
        {
          "category": "%s",
          "category_explanation": "matches the description",
          "event_summary": "customer hit an issue",
          "sentiment": "%s",
          "suggested_action": "raise the limit",
          "suggestion_link": "https://docs.example.com/limits"
        }
        ```"""
        .formatted(category, sentiment);
  }

  public static String summary() {
    return "{\"summary\": \"Mostly throttling issues.\","
        + " \"plan\": [\"Add retries\", \"Request quota\"]}";
  }
}
