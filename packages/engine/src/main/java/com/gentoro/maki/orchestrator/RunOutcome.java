package com.gentoro.maki.orchestrator;

import com.gentoro.maki.event.EventRecord;
import com.gentoro.maki.exception.ErrorDetails;
import com.gentoro.maki.mode.Mode;
import com.gentoro.maki.result.ClassificationOutcome;
import com.gentoro.maki.routing.Route;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Externally visible record of a finished run, persisted as {@code runs/<runId>/outcome.json}. */
public record RunOutcome(
    String runId,
    Mode mode,
    int eventsTotal,
    List<String> events,
    Route route,
    RunState state,
    String status,
    String reason,
    String batchJobId,
    int succeeded,
    int failed,
    Map<String, String> failedEvents,
    String summaryRef,
    Map<String, Instant> stageTimestamps,
    Instant startedAt,
    Instant finishedAt,
    ErrorDetails error) {

  public static final String STATUS_COMPLETED = "completed";
  public static final String STATUS_NO_EVENTS = "no events were found to process";
  public static final String STATUS_MODELS_NOT_ENABLED =
      "Execution stopped: inference models not enabled";
  public static final String STATUS_JOB_IN_PROGRESS =
      "Execution stopped: batch inference jobs in progress";
  public static final String STATUS_CANCELLED = "Execution cancelled";

  public static final String REASON_CANCELLED = "cancelled";
  public static final String REASON_NO_RESULTS = "no-analysis-results";

  public static String failedStatus(String reason) {
    return "Execution failed: " + reason;
  }

  public boolean isSuccess() {
    return state == RunState.COMPLETED || state == RunState.NO_EVENTS;
  }

  static RunOutcome of(
      RunContext ctx, String status, String reason, ErrorDetails error, Instant finishedAt) {
    List<String> ids = ctx.events().stream().map(EventRecord::id).toList();
    Map<String, String> failures = new LinkedHashMap<>();
    int ok = 0;
    for (ClassificationOutcome o : ctx.outcomes()) {
      if (o.isSuccess()) {
        ok++;
      } else {
        failures.put(o.eventId(), o.error());
      }
    }
    Map<String, Instant> stamps = new LinkedHashMap<>();
    ctx.stageTimestamps().forEach((k, v) -> stamps.put(k.name(), v));
    return new RunOutcome(
        ctx.runId(),
        ctx.mode(),
        ids.size(),
        ids,
        ctx.route(),
        ctx.state(),
        status,
        reason,
        ctx.batchJobId(),
        ok,
        failures.size(),
        failures,
        ctx.summaryRef(),
        stamps,
        ctx.startedAt(),
        finishedAt,
        error);
  }
}
