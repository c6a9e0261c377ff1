package com.gentoro.maki.aggregate;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.maki.exception.ValidationException;
import com.gentoro.maki.logging.LoggingService;
import com.gentoro.maki.mode.Mode;
import com.gentoro.maki.model.LlmClient;
import com.gentoro.maki.orchestrator.RetryPolicy;
import com.gentoro.maki.orchestrator.RunControl;
import com.gentoro.maki.prompt.PromptRepository;
import com.gentoro.maki.result.AggregateSummary;
import com.gentoro.maki.result.AnalysisResult;
import com.gentoro.maki.result.ResultWriter;
import com.gentoro.maki.utility.JacksonUtility;
import com.gentoro.maki.utility.StringUtility;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;

/**
 * Synthesizes one {@link AggregateSummary} from all results of a run with the heavy model.
 *
 * <p>Each result becomes a short digest block. When the digests exceed {@code maxInputChars} they
 * are split into chunks that are condensed separately first, repeating until the combined text
 * fits the final synthesis prompt.
 */
public class OutputAggregator {
  private static final Logger log = LoggingService.getLogger(OutputAggregator.class);

  public static final String AGGREGATE_TEMPLATE = "aggregate";
  public static final String CONDENSE_TEMPLATE = "condense";
  static final String SEPARATOR = "\n\n";
  static final int MAX_CONDENSE_ROUNDS = 4;
  static final String OUTPUT_FORMAT = "{\"summary\": \"<summary>\", \"plan\": \"<plan>\"}";

  private final LlmClient llm;
  private final PromptRepository prompts;
  private final RetryPolicy retryPolicy;
  private final ResultWriter writer;
  private final int maxInputChars;

  public OutputAggregator(
      LlmClient llm,
      PromptRepository prompts,
      RetryPolicy retryPolicy,
      ResultWriter writer,
      int maxInputChars) {
    this.llm = llm;
    this.prompts = prompts;
    this.retryPolicy = retryPolicy;
    this.writer = writer;
    this.maxInputChars = maxInputChars;
  }

  public AggregateSummary aggregate(String runId, List<AnalysisResult> results) {
    return aggregate(runId, results, RunControl.unbounded());
  }

  /**
   * @throws ValidationException when {@code results} is empty or the model reply has no summary
   * @throws com.gentoro.maki.exception.TransientInferenceException once retries are exhausted
   */
  public AggregateSummary aggregate(
      String runId, List<AnalysisResult> results, RunControl control) {
    if (results == null || results.isEmpty()) {
      throw new ValidationException("Cannot aggregate a run without analysis results");
    }
    Mode mode = results.get(0).mode();
    List<String> blocks = new ArrayList<>(results.size());
    results.forEach(r -> blocks.add(digest(r)));

    String digest = fit(mode, blocks, control);
    String completion =
        retryPolicy.execute(
            "aggregate run " + runId,
            () -> llm.chat(renderSynthesis(mode, digest)),
            control);

    AggregateSummary summary = parse(completion);
    writer.writeSummary(runId, summary);
    log.info("Aggregated {} result(s) for run {}", results.size(), runId);
    return summary;
  }

  static String digest(AnalysisResult r) {
    return "event: %s\ncategory: %s\nsentiment: %s\nsummary: %s"
        .formatted(
            r.eventId(),
            r.category(),
            r.sentiment().label(),
            r.summary() == null ? "" : r.summary());
  }

  private String fit(Mode mode, List<String> blocks, RunControl control) {
    List<String> current = blocks;
    int round = 0;
    while (joinedLength(current) > maxInputChars) {
      if (++round > MAX_CONDENSE_ROUNDS) {
        log.warn("Digest still too large after {} condense rounds; truncating", MAX_CONDENSE_ROUNDS);
        return String.join(SEPARATOR, current).substring(0, maxInputChars);
      }
      List<String> chunks = StringUtility.chunk(current, SEPARATOR, maxInputChars);
      log.info("Condensing {} digest chunk(s), round {}", chunks.size(), round);
      List<String> condensed = new ArrayList<>(chunks.size());
      for (int i = 0; i < chunks.size(); i++) {
        String chunk = chunks.get(i);
        condensed.add(
            retryPolicy.execute(
                "condense chunk " + (i + 1) + "/" + chunks.size(),
                () -> llm.chat(render(CONDENSE_TEMPLATE, mode, chunk)),
                control));
      }
      current = condensed;
    }
    return String.join(SEPARATOR, current);
  }

  /** The synthesis template holds one reviewer and one request section per mode. */
  private List<LlmClient.Message> renderSynthesis(Mode mode, String digest) {
    Map<String, Object> vars = variables(mode, digest);
    return prompts
        .get(AGGREGATE_TEMPLATE)
        .newSession()
        .enable(mode.value() + "-reviewer", vars)
        .enable(mode.value() + "-request", vars)
        .renderMessages();
  }

  private static Map<String, Object> variables(Mode mode, String digest) {
    return Map.of("eventNoun", mode.eventNoun(), "digest", digest, "outputFormat", OUTPUT_FORMAT);
  }

  private List<LlmClient.Message> render(String template, Mode mode, String digest) {
    return prompts
        .get(template)
        .newSession()
        .withDefaults(variables(mode, digest))
        .renderMessages();
  }

  static AggregateSummary parse(String completion) {
    String json = StringUtility.extractJsonObject(completion);
    if (json == null) {
      throw new ValidationException(
          "Aggregate reply holds no JSON object: " + StringUtility.truncate(completion, 200));
    }
    JsonNode node;
    try {
      node = JacksonUtility.getJsonMapper().readTree(json);
    } catch (IOException e) {
      throw new ValidationException("Aggregate reply is not valid JSON", e);
    }
    String summary = flatten(node.get("summary"));
    if (summary == null || summary.isBlank()) {
      throw new ValidationException("Aggregate reply has no summary");
    }
    String plan = flatten(node.get("plan"));
    return new AggregateSummary(summary, plan == null ? "" : plan);
  }

  private static String flatten(JsonNode node) {
    if (node == null || node.isNull()) return null;
    if (node.isArray()) {
      List<String> lines = new ArrayList<>();
      node.forEach(n -> lines.add("- " + (n.isTextual() ? n.asText() : n.toString())));
      return String.join("\n", lines);
    }
    return node.isTextual() ? node.asText().trim() : node.toString();
  }

  private static int joinedLength(List<String> blocks) {
    int total = 0;
    for (String b : blocks) total += b.length();
    return total + Math.max(0, blocks.size() - 1) * SEPARATOR.length();
  }
}
