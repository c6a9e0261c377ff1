package com.gentoro.maki.orchestrator.progress;

import com.gentoro.maki.utility.JacksonUtility;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;

/**
 * Progress sink that emits one structured JSON line per event to the application log, prefixed
 * with {@code [orchestration.progress]}.
 *
 * <p>Steps are rate limited by a {@link ProgressRateLimiter} per stage; stage begin and end events
 * are never dropped. Payload shape:
 *
 * <pre>
 * {
 *   "stageId": "ON_DEMAND_RUNNING",
 *   "label": "Classifying events on demand",
 *   "completed": 3,
 *   "total": 5,
 *   "percent": 60,
 *   "message": "event 1234 classified",
 *   "attrs": { ... },
 *   "status": "running|ok|error",
 *   "protocolVersion": 1
 * }
 * </pre>
 */
public class LoggingProgressSink implements ProgressSink {
  private static final int PROTOCOL_VERSION = 1;

  private final Logger log;
  private final long minIntervalMs;
  private final long minDelta;

  private final Map<String, Stage> stages = new ConcurrentHashMap<>();

  private static final class Stage {
    final String label;
    final long total;
    final ProgressRateLimiter limiter;
    volatile long completed;

    Stage(String label, long total, ProgressRateLimiter limiter) {
      this.label = label;
      this.total = total;
      this.limiter = limiter;
    }
  }

  public LoggingProgressSink(Logger logger, long minIntervalMs, long minDelta) {
    this.log = Objects.requireNonNull(logger, "logger");
    this.minIntervalMs = minIntervalMs;
    this.minDelta = minDelta;
  }

  @Override
  public void beginStage(String id, String label, long totalWork) {
    Stage stage =
        new Stage(label, Math.max(0, totalWork), new ProgressRateLimiter(minIntervalMs, minDelta));
    stages.put(id, stage);
    emit(id, stage, 0L, "begin", Map.of(), "running");
  }

  @Override
  public void step(String id, long completed, String message, Map<String, Object> attrs) {
    Stage stage = stages.computeIfAbsent(id, k -> new Stage(k, 0, new ProgressRateLimiter(0, 0)));
    stage.completed = Math.max(stage.completed, completed);
    if (stage.limiter.tryAcquire(System.currentTimeMillis(), completed)) {
      emit(id, stage, completed, message, attrs, "running");
    }
  }

  @Override
  public void endStageOk(String id, Map<String, Object> attrs) {
    Stage stage = stages.getOrDefault(id, new Stage(id, 0, null));
    emit(id, stage, Math.max(stage.total, stage.completed), "end", attrs, "ok");
  }

  @Override
  public void endStageError(String id, String errorSummary, Map<String, Object> attrs) {
    Stage stage = stages.getOrDefault(id, new Stage(id, 0, null));
    Map<String, Object> merged = new HashMap<>();
    if (attrs != null) merged.putAll(attrs);
    if (errorSummary != null) merged.put("error", errorSummary);
    emit(id, stage, stage.completed, "error", merged, "error");
  }

  /** Build the payload map. */
  protected Map<String, Object> createPayload(
      String id,
      String label,
      long completed,
      long total,
      String message,
      Map<String, Object> attrs,
      String status) {
    long safeCompleted = total > 0 ? Math.min(Math.max(0, completed), total) : Math.max(0, completed);
    int percent = total > 0 ? (int) Math.round((safeCompleted * 100.0) / total) : 0;
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("stageId", id);
    payload.put("label", label);
    payload.put("completed", safeCompleted);
    payload.put("total", total);
    payload.put("percent", percent);
    payload.put("message", message);
    payload.put("attrs", attrs == null ? Map.of() : attrs);
    payload.put("status", status);
    payload.put("protocolVersion", PROTOCOL_VERSION);
    return payload;
  }

  private void emit(
      String id,
      Stage stage,
      long completed,
      String message,
      Map<String, Object> attrs,
      String status) {
    Map<String, Object> payload =
        createPayload(id, stage.label, completed, stage.total, message, attrs, status);
    log.info("[orchestration.progress] {}", JacksonUtility.toJsonLine(payload));
  }
}
