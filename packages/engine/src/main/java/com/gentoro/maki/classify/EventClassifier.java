package com.gentoro.maki.classify;

import com.gentoro.maki.event.EventRecord;
import com.gentoro.maki.model.LlmClient;
import com.gentoro.maki.orchestrator.RetryPolicy;
import com.gentoro.maki.orchestrator.RunControl;
import com.gentoro.maki.result.AnalysisResult;
import java.util.List;

/** Classifies a single event with the light model. */
public class EventClassifier {
  private final LlmClient llm;
  private final ClassificationPrompt prompt;
  private final ClassificationParser parser;
  private final RetryPolicy retryPolicy;

  public EventClassifier(
      LlmClient llm,
      ClassificationPrompt prompt,
      ClassificationParser parser,
      RetryPolicy retryPolicy) {
    this.llm = llm;
    this.prompt = prompt;
    this.parser = parser;
    this.retryPolicy = retryPolicy;
  }

  /**
   * @throws com.gentoro.maki.exception.TransientInferenceException once retries are exhausted
   * @throws com.gentoro.maki.exception.ValidationException when the completion cannot be parsed
   */
  public AnalysisResult classify(EventRecord event, RunControl control) {
    List<LlmClient.Message> messages = prompt.render(event);
    String completion =
        retryPolicy.execute("classify event " + event.id(), () -> llm.chat(messages), control);
    return parser.parse(event, completion);
  }
}
