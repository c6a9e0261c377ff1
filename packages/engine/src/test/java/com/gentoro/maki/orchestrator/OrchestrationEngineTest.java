package com.gentoro.maki.orchestrator;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.maki.Maki;
import com.gentoro.maki.batch.BatchJob;
import com.gentoro.maki.batch.BatchJobStatus;
import com.gentoro.maki.mode.Mode;
import com.gentoro.maki.result.ResultWriter;
import com.gentoro.maki.routing.Route;
import com.gentoro.maki.support.FakeLlmClient;
import com.gentoro.maki.support.TestConfigs;
import com.gentoro.maki.support.TestEvents;
import com.gentoro.maki.utility.JacksonUtility;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import org.apache.commons.configuration2.Configuration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("OrchestrationEngine end-to-end runs")
class OrchestrationEngineTest {

  @TempDir Path root;

  private Configuration cfg;
  private FakeLlmClient light;
  private FakeLlmClient heavy;
  private Maki maki;

  @BeforeEach
  void setUp() {
    cfg = TestConfigs.engine(root);
    light =
        new FakeLlmClient(
            "light",
            messages ->
                FakeLlmClient.userText(messages).contains("case-0003")
                    ? "I cannot answer that."
                    : FakeLlmClient.classification("throttling", "Negative"));
    heavy = new FakeLlmClient("heavy", messages -> FakeLlmClient.summary());
  }

  @AfterEach
  void tearDown() {
    if (maki != null) maki.close();
  }

  private Maki start() {
    maki = new Maki(cfg, light, heavy, Clock.systemUTC());
    maki.modeStore().write(Mode.CASES);
    return maki;
  }

  @Test
  @DisplayName("No events ends the run without results or summary")
  void noEvents() {
    RunOutcome outcome = start().run();

    assertEquals(RunState.NO_EVENTS, outcome.state());
    assertEquals(Route.NO_EVENTS, outcome.route());
    assertEquals(0, outcome.eventsTotal());
    assertTrue(outcome.events().isEmpty());
    assertEquals("no events were found to process", outcome.status());
    assertTrue(outcome.isSuccess());
    assertEquals(0, light.calls());
    assertEquals(0, heavy.calls());
    assertFalse(maki.objectStore().exists(ResultWriter.summaryKey(outcome.runId())));
    assertTrue(maki.objectStore().exists(ResultWriter.outcomeKey(outcome.runId())));
  }

  @Test
  @DisplayName("Small volume is classified on demand and aggregated")
  void onDemandRun() throws Exception {
    TestEvents.writeCases(root.resolve("cases"), TestEvents.supportCases(5));
    light =
        new FakeLlmClient(
            "light", messages -> FakeLlmClient.classification("throttling", "Negative"));

    RunOutcome outcome = start().run();

    assertEquals(RunState.COMPLETED, outcome.state());
    assertEquals(Route.ON_DEMAND, outcome.route());
    assertEquals(5, outcome.eventsTotal());
    assertEquals(5, outcome.succeeded());
    assertEquals(0, outcome.failed());
    assertNull(outcome.batchJobId());
    assertEquals(5, light.calls());
    assertEquals(1, heavy.calls());
    assertEquals(
        5,
        maki.objectStore()
            .list(ResultWriter.runPrefix(outcome.runId()) + ResultWriter.ON_DEMAND + "/")
            .size());
    assertEquals(ResultWriter.summaryKey(outcome.runId()), outcome.summaryRef());
    String summary = maki.objectStore().get(outcome.summaryRef()).orElseThrow();
    assertTrue(summary.contains("Mostly throttling issues."));
    assertTrue(summary.contains("- Add retries"));
  }

  @Test
  @DisplayName("A failing event does not stop its siblings")
  void onDemandPartialFailure() throws Exception {
    TestEvents.writeCases(root.resolve("cases"), TestEvents.supportCases(5));

    RunOutcome outcome = start().run();

    assertEquals(RunState.COMPLETED, outcome.state());
    assertEquals(4, outcome.succeeded());
    assertEquals(1, outcome.failed());
    assertTrue(outcome.failedEvents().containsKey("case-0003"));
    assertFalse(
        maki.objectStore()
            .exists(ResultWriter.resultKey(outcome.runId(), ResultWriter.ON_DEMAND, "case-0003")));
  }

  @Test
  @DisplayName("Every event failing ends the run without aggregation")
  void allEventsFail() throws Exception {
    TestEvents.writeCases(root.resolve("cases"), TestEvents.supportCases(3));
    light = new FakeLlmClient("light", messages -> "no json here");

    RunOutcome outcome = start().run();

    assertEquals(RunState.FAILED, outcome.state());
    assertEquals(RunOutcome.REASON_NO_RESULTS, outcome.reason());
    assertEquals(3, outcome.failed());
    assertEquals(0, heavy.calls());
    assertNull(outcome.summaryRef());
  }

  @Test
  @DisplayName("Large volume goes through one batch job")
  void batchRun() throws Exception {
    TestEvents.writeCases(root.resolve("cases"), TestEvents.supportCases(150));

    RunOutcome outcome = start().run();

    assertEquals(RunState.COMPLETED, outcome.state(), outcome.status());
    assertEquals(Route.BATCH, outcome.route());
    assertEquals(150, outcome.eventsTotal());
    assertEquals(149, outcome.succeeded());
    assertEquals(1, outcome.failed());
    assertNotNull(outcome.batchJobId());
    assertEquals(150, light.calls());
    assertEquals(1, heavy.calls());

    BatchJob job = maki.batchJobStore().find(outcome.batchJobId()).orElseThrow();
    assertEquals(BatchJobStatus.COMPLETED, job.status());
    assertEquals(150, job.recordCount());
    assertEquals(
        149,
        maki.objectStore()
            .list(ResultWriter.runPrefix(outcome.runId()) + ResultWriter.BATCH + "/")
            .size());
    assertTrue(maki.objectStore().list(BatchJob.prefix(job.jobId())).isEmpty());
  }

  @Test
  @DisplayName("Unavailable model blocks the run before any event is read")
  void modelUnavailable() throws Exception {
    TestEvents.writeCases(root.resolve("cases"), TestEvents.supportCases(5));
    heavy.available(false);

    RunOutcome outcome = start().run();

    assertEquals(RunState.FAILED, outcome.state());
    assertEquals(RunOutcome.STATUS_MODELS_NOT_ENABLED, outcome.status());
    assertEquals("model-unavailable", outcome.reason());
    assertEquals(0, outcome.eventsTotal());
    assertEquals(0, light.calls());
    assertEquals(0, heavy.calls());
    // only the outcome record is written
    assertEquals(
        List.of(ResultWriter.outcomeKey(outcome.runId())),
        maki.objectStore().list(ResultWriter.runPrefix(outcome.runId())));
    assertFalse(maki.objectStore().exists(ResultWriter.summaryKey(outcome.runId())));
  }

  @Test
  @DisplayName("An in-flight batch job of the same mode blocks the run")
  void jobInProgress() throws Exception {
    TestEvents.writeCases(root.resolve("cases"), TestEvents.supportCases(5));
    start();
    maki.batchJobStore()
        .save(BatchJob.building("cases-previous", Mode.CASES, "previous", 120, Instant.now()));

    RunOutcome outcome = maki.run();

    assertEquals(RunState.FAILED, outcome.state());
    assertEquals(RunOutcome.STATUS_JOB_IN_PROGRESS, outcome.status());
    assertEquals("job-in-progress", outcome.reason());
    assertEquals(0, light.calls());
  }

  @Test
  @DisplayName("An in-flight job of the other mode does not block")
  void otherModeJobDoesNotBlock() throws Exception {
    TestEvents.writeCases(root.resolve("cases"), TestEvents.supportCases(2));
    light =
        new FakeLlmClient(
            "light", messages -> FakeLlmClient.classification("throttling", "Neutral"));
    start();
    maki.batchJobStore()
        .save(BatchJob.building("health-previous", Mode.HEALTH, "previous", 120, Instant.now()));

    RunOutcome outcome = maki.run();

    assertEquals(RunState.COMPLETED, outcome.state());
  }

  @Test
  @DisplayName("Missing mode parameter fails the run with a configuration error")
  void missingMode() {
    maki = new Maki(cfg, light, heavy, Clock.systemUTC());

    RunOutcome outcome = maki.run();

    assertEquals(RunState.FAILED, outcome.state());
    assertEquals("configuration-error", outcome.reason());
    assertNull(outcome.mode());
    assertNotNull(outcome.error());
  }

  @Test
  @DisplayName("Configured fallback mode is used when the parameter is missing")
  void fallbackMode() {
    cfg.setProperty("mode.fallback", "health");
    maki = new Maki(cfg, light, heavy, Clock.systemUTC());

    RunOutcome outcome = maki.run();

    assertEquals(Mode.HEALTH, outcome.mode());
    assertEquals(RunState.NO_EVENTS, outcome.state());
  }

  @Test
  @DisplayName("Cancelling before the run starts stops it without dispatching events")
  void cancelledRun() throws Exception {
    TestEvents.writeCases(root.resolve("cases"), TestEvents.supportCases(5));
    start();
    RunControl control = RunControl.unbounded();
    control.cancel();

    RunOutcome outcome = maki.engine().run(control);

    assertEquals(RunState.FAILED, outcome.state());
    assertEquals(RunOutcome.STATUS_CANCELLED, outcome.status());
    assertEquals(RunOutcome.REASON_CANCELLED, outcome.reason());
    assertEquals(0, light.calls());
  }

  @Test
  @DisplayName("Stage timestamps follow the state order and the outcome is persisted")
  void outcomeRecord() throws Exception {
    TestEvents.writeCases(root.resolve("cases"), TestEvents.supportCases(1));
    light =
        new FakeLlmClient(
            "light", messages -> FakeLlmClient.classification("throttling", "Neutral"));

    RunOutcome outcome = start().run();

    assertEquals(
        List.of(
            "INIT",
            "MODE_RESOLVED",
            "PRECONDITIONS_CHECKED",
            "ROUTED",
            "ON_DEMAND_RUNNING",
            "AGGREGATING",
            "COMPLETED"),
        List.copyOf(outcome.stageTimestamps().keySet()));
    String stored = maki.objectStore().get(ResultWriter.outcomeKey(outcome.runId())).orElseThrow();
    assertEquals(
        outcome.runId(),
        JacksonUtility.getJsonMapper().readTree(stored).get("runId").asText());
  }
}
