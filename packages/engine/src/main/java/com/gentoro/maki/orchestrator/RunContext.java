package com.gentoro.maki.orchestrator;

import com.gentoro.maki.event.EventRecord;
import com.gentoro.maki.exception.StateException;
import com.gentoro.maki.mode.Mode;
import com.gentoro.maki.result.AnalysisResult;
import com.gentoro.maki.result.ClassificationOutcome;
import com.gentoro.maki.routing.Route;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Mutable state of one run, owned by the engine thread. */
public final class RunContext {
  private final String runId;
  private final Instant startedAt;
  private final Map<RunState, Instant> stageTimestamps = new LinkedHashMap<>();
  private RunState state;
  private Mode mode;
  private List<EventRecord> events = List.of();
  private Route route;
  private String batchJobId;
  private String summaryRef;
  private List<ClassificationOutcome> outcomes = List.of();

  RunContext(String runId, Instant now) {
    this.runId = runId;
    this.startedAt = now;
    this.state = RunState.INIT;
    stageTimestamps.put(RunState.INIT, now);
  }

  void transition(RunState next, Instant now) {
    if (state.isTerminal()) {
      throw new StateException("Run %s is already %s".formatted(runId, state));
    }
    state = next;
    stageTimestamps.put(next, now);
  }

  public String runId() {
    return runId;
  }

  public Instant startedAt() {
    return startedAt;
  }

  public RunState state() {
    return state;
  }

  public Map<RunState, Instant> stageTimestamps() {
    return Collections.unmodifiableMap(stageTimestamps);
  }

  public Mode mode() {
    return mode;
  }

  void mode(Mode mode) {
    this.mode = mode;
  }

  public List<EventRecord> events() {
    return events;
  }

  void events(List<EventRecord> events) {
    this.events = List.copyOf(events);
  }

  public Route route() {
    return route;
  }

  void route(Route route) {
    this.route = route;
  }

  public String batchJobId() {
    return batchJobId;
  }

  void batchJobId(String batchJobId) {
    this.batchJobId = batchJobId;
  }

  public String summaryRef() {
    return summaryRef;
  }

  void summaryRef(String summaryRef) {
    this.summaryRef = summaryRef;
  }

  public List<ClassificationOutcome> outcomes() {
    return outcomes;
  }

  void outcomes(List<ClassificationOutcome> outcomes) {
    this.outcomes = List.copyOf(outcomes);
  }

  public List<AnalysisResult> results() {
    List<AnalysisResult> out = new ArrayList<>();
    for (ClassificationOutcome o : outcomes) {
      if (o.isSuccess()) out.add(o.result());
    }
    return out;
  }
}
