package com.gentoro.maki.orchestrator;

import com.gentoro.maki.aggregate.OutputAggregator;
import com.gentoro.maki.batch.BatchJob;
import com.gentoro.maki.batch.BatchJobManager;
import com.gentoro.maki.event.EventRecord;
import com.gentoro.maki.event.EventSourceRegistry;
import com.gentoro.maki.exception.ErrorDetails;
import com.gentoro.maki.exception.ExceptionUtil;
import com.gentoro.maki.exception.MakiException;
import com.gentoro.maki.exception.RunCancelledException;
import com.gentoro.maki.gate.GateDecision;
import com.gentoro.maki.gate.PreconditionGate;
import com.gentoro.maki.logging.LoggingService;
import com.gentoro.maki.mode.Mode;
import com.gentoro.maki.mode.ModeSelector;
import com.gentoro.maki.ondemand.OnDemandExecutor;
import com.gentoro.maki.orchestrator.progress.NoOpProgressSink;
import com.gentoro.maki.orchestrator.progress.ProgressSink;
import com.gentoro.maki.result.AnalysisResult;
import com.gentoro.maki.result.ClassificationOutcome;
import com.gentoro.maki.result.ResultWriter;
import com.gentoro.maki.routing.Route;
import com.gentoro.maki.routing.VolumeRouter;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Runs the pipeline once: resolve the mode, check preconditions, count and route the events,
 * classify them on demand or in a batch job, then aggregate.
 *
 * <p>Every transition is time-stamped in the {@link RunContext} and reported to the {@link
 * ProgressSink}. Failures never escape {@link #run(RunControl)}; they end the run in {@link
 * RunState#FAILED} with a reason. Each invocation starts from {@link RunState#INIT}.
 */
public class OrchestrationEngine {
  private static final Logger log = LoggingService.getLogger(OrchestrationEngine.class);

  private static final DateTimeFormatter RUN_ID_TIME =
      DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'").withZone(ZoneOffset.UTC);

  private final ModeSelector modeSelector;
  private final PreconditionGate gate;
  private final EventSourceRegistry sources;
  private final VolumeRouter router;
  private final OnDemandExecutor onDemand;
  private final BatchJobManager batchJobs;
  private final OutputAggregator aggregator;
  private final ResultWriter writer;
  private final long runTimeoutMs;
  private final ProgressSink progress;
  private final Clock clock;
  private final Supplier<String> runIds;

  public OrchestrationEngine(
      ModeSelector modeSelector,
      PreconditionGate gate,
      EventSourceRegistry sources,
      VolumeRouter router,
      OnDemandExecutor onDemand,
      BatchJobManager batchJobs,
      OutputAggregator aggregator,
      ResultWriter writer,
      long runTimeoutMs,
      ProgressSink progress,
      Clock clock) {
    this.modeSelector = modeSelector;
    this.gate = gate;
    this.sources = sources;
    this.router = router;
    this.onDemand = onDemand;
    this.batchJobs = batchJobs;
    this.aggregator = aggregator;
    this.writer = writer;
    this.runTimeoutMs = runTimeoutMs;
    this.progress = progress == null ? new NoOpProgressSink() : progress;
    this.clock = clock;
    this.runIds =
        () ->
            RUN_ID_TIME.format(clock.instant())
                + "-"
                + UUID.randomUUID().toString().substring(0, 8);
  }

  public RunOutcome run() {
    return run(RunControl.withTimeout(runTimeoutMs));
  }

  public RunOutcome run(RunControl control) {
    RunContext ctx = new RunContext(runIds.get(), clock.instant());
    try (MDC.MDCCloseable ignored = LoggingService.runScope(ctx.runId())) {
      log.info("Run {} started", ctx.runId());
      progress.beginStage(RunState.INIT.name(), RunState.INIT.label(), 0);
      RunOutcome outcome = execute(ctx, control);
      persist(outcome);
      log.info(
          "Run {} finished in state {}: {} ({} succeeded, {} failed)",
          ctx.runId(),
          outcome.state(),
          outcome.status(),
          outcome.succeeded(),
          outcome.failed());
      return outcome;
    }
  }

  private RunOutcome execute(RunContext ctx, RunControl control) {
    try {
      Mode mode = modeSelector.resolve();
      ctx.mode(mode);
      enter(ctx, RunState.MODE_RESOLVED, 0, Map.of("mode", mode.value()));

      GateDecision decision = gate.check(mode);
      if (decision instanceof GateDecision.Blocked blocked) {
        return blocked(ctx, blocked);
      }
      enter(ctx, RunState.PRECONDITIONS_CHECKED, 0, Map.of());

      List<EventRecord> events = sources.forMode(mode).list();
      ctx.events(events);
      Route route = router.route(events.size());
      ctx.route(route);
      enter(ctx, RunState.ROUTED, 0, Map.of("events", events.size(), "route", route.name()));

      if (route == Route.NO_EVENTS) {
        enter(ctx, RunState.NO_EVENTS, 0, Map.of());
        return RunOutcome.of(ctx, RunOutcome.STATUS_NO_EVENTS, null, null, clock.instant());
      }

      control.checkActive();
      List<ClassificationOutcome> outcomes =
          route == Route.ON_DEMAND
              ? runOnDemand(ctx, events, control)
              : runBatch(ctx, mode, events, control);
      ctx.outcomes(outcomes);
      control.checkActive();

      List<AnalysisResult> results = ctx.results();
      if (results.isEmpty()) {
        return fail(ctx, RunOutcome.REASON_NO_RESULTS, null);
      }

      enter(ctx, RunState.AGGREGATING, 1, Map.of("results", results.size()));
      aggregator.aggregate(ctx.runId(), results, control);
      ctx.summaryRef(ResultWriter.summaryKey(ctx.runId()));
      enter(ctx, RunState.COMPLETED, 0, Map.of());
      return RunOutcome.of(ctx, RunOutcome.STATUS_COMPLETED, null, null, clock.instant());
    } catch (RunCancelledException e) {
      if (e.isDeadlineExceeded()) {
        return fail(ctx, reasonOf(e), e);
      }
      log.warn("Run {} cancelled in state {}", ctx.runId(), ctx.state());
      closeStage(ctx, "cancelled");
      markFailed(ctx);
      return RunOutcome.of(
          ctx,
          RunOutcome.STATUS_CANCELLED,
          RunOutcome.REASON_CANCELLED,
          ExceptionUtil.toErrorDetails(e),
          clock.instant());
    } catch (RuntimeException e) {
      return fail(ctx, reasonOf(e), e);
    }
  }

  private List<ClassificationOutcome> runOnDemand(
      RunContext ctx, List<EventRecord> events, RunControl control) {
    enter(ctx, RunState.ON_DEMAND_RUNNING, events.size(), Map.of());
    return onDemand.run(ctx.runId(), events, control, progress, RunState.ON_DEMAND_RUNNING.name());
  }

  private List<ClassificationOutcome> runBatch(
      RunContext ctx, Mode mode, List<EventRecord> events, RunControl control) {
    enter(ctx, RunState.BATCH_RUNNING, events.size(), Map.of());
    BatchJob job = batchJobs.submit(mode, events, ctx.runId());
    ctx.batchJobId(job.jobId());
    progress.step(
        RunState.BATCH_RUNNING.name(), 0, "batch job submitted", Map.of("jobId", job.jobId()));
    job = batchJobs.awaitCompletion(job, control);
    List<ClassificationOutcome> outcomes = batchJobs.fetch(job, events);
    batchJobs.cleanup(job);
    return outcomes;
  }

  private RunOutcome blocked(RunContext ctx, GateDecision.Blocked blocked) {
    String status =
        GateDecision.MODEL_UNAVAILABLE.equals(blocked.reason())
            ? RunOutcome.STATUS_MODELS_NOT_ENABLED
            : RunOutcome.STATUS_JOB_IN_PROGRESS;
    MakiException error = blocked.toException();
    closeStage(ctx, blocked.reason());
    markFailed(ctx);
    log.warn("Run {} stopped: {}", ctx.runId(), error.getMessage());
    return RunOutcome.of(
        ctx, status, blocked.reason(), ExceptionUtil.toErrorDetails(error), clock.instant());
  }

  private RunOutcome fail(RunContext ctx, String reason, Throwable error) {
    if (error != null) {
      log.error("Run {} failed in state {}: {}", ctx.runId(), ctx.state(), reason, error);
    } else {
      log.error("Run {} failed in state {}: {}", ctx.runId(), ctx.state(), reason);
    }
    closeStage(ctx, reason);
    ErrorDetails details = error == null ? null : ExceptionUtil.toErrorDetails(error);
    markFailed(ctx);
    return RunOutcome.of(ctx, RunOutcome.failedStatus(reason), reason, details, clock.instant());
  }

  private void markFailed(RunContext ctx) {
    if (!ctx.state().isTerminal()) {
      ctx.transition(RunState.FAILED, clock.instant());
    }
  }

  /** End the current stage and start {@code next}. */
  private void enter(RunContext ctx, RunState next, long totalWork, Map<String, Object> attrs) {
    progress.endStageOk(ctx.state().name(), attrs);
    ctx.transition(next, clock.instant());
    log.debug("Run {} entered {}", ctx.runId(), next);
    progress.beginStage(next.name(), next.label(), totalWork);
    if (next.isTerminal()) {
      progress.endStageOk(next.name(), Map.of());
    }
  }

  private void closeStage(RunContext ctx, String reason) {
    progress.endStageError(ctx.state().name(), reason, Map.of());
  }

  static String reasonOf(Throwable e) {
    if (e instanceof MakiException me) {
      return me.getCode().name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
    return "unknown";
  }

  private void persist(RunOutcome outcome) {
    try {
      writer.writeOutcome(outcome.runId(), outcome);
    } catch (MakiException e) {
      log.error("Could not persist outcome of run {}", outcome.runId(), e);
    }
  }
}
