package com.gentoro.maki.ondemand;

import com.gentoro.maki.classify.EventClassifier;
import com.gentoro.maki.event.EventRecord;
import com.gentoro.maki.exception.ExceptionUtil;
import com.gentoro.maki.exception.RunCancelledException;
import com.gentoro.maki.logging.LoggingService;
import com.gentoro.maki.orchestrator.RunControl;
import com.gentoro.maki.orchestrator.progress.ProgressSink;
import com.gentoro.maki.result.AnalysisResult;
import com.gentoro.maki.result.ClassificationOutcome;
import com.gentoro.maki.result.ResultWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Classifies events one call each on a bounded worker pool and waits for all of them. A failing
 * event yields an error outcome and never affects its siblings. After cancellation, events whose
 * task has not started yet are reported as not dispatched.
 */
public class OnDemandExecutor {
  private static final Logger log = LoggingService.getLogger(OnDemandExecutor.class);

  static final String NOT_DISPATCHED = "not dispatched: run cancelled";

  private final EventClassifier classifier;
  private final ResultWriter writer;
  private final int workers;

  public OnDemandExecutor(EventClassifier classifier, ResultWriter writer, int workers) {
    this.classifier = classifier;
    this.writer = writer;
    this.workers = workers;
  }

  /**
   * @param stageId progress stage the per-event steps are reported under
   * @return one outcome per event, in event order
   */
  public List<ClassificationOutcome> run(
      String runId,
      List<EventRecord> events,
      RunControl control,
      ProgressSink progress,
      String stageId) {
    if (events.isEmpty()) return List.of();

    ExecutorService pool =
        Executors.newFixedThreadPool(Math.min(workers, events.size()), threadFactory(runId));
    Map<String, String> mdc = MDC.getCopyOfContextMap();
    AtomicLong done = new AtomicLong();
    List<Future<ClassificationOutcome>> futures = new ArrayList<>(events.size());
    try {
      for (EventRecord event : events) {
        futures.add(
            pool.submit(
                () -> {
                  if (mdc != null) MDC.setContextMap(mdc);
                  try {
                    ClassificationOutcome outcome = classifyOne(runId, event, control);
                    progress.step(
                        stageId,
                        done.incrementAndGet(),
                        outcome.isSuccess()
                            ? "event " + event.id() + " classified"
                            : "event " + event.id() + " failed",
                        Map.of("eventId", event.id()));
                    return outcome;
                  } finally {
                    MDC.clear();
                  }
                }));
      }

      List<ClassificationOutcome> outcomes = new ArrayList<>(events.size());
      for (int i = 0; i < futures.size(); i++) {
        outcomes.add(await(events.get(i), futures.get(i)));
      }
      long failed = outcomes.stream().filter(o -> !o.isSuccess()).count();
      log.info(
          "On-demand classification finished: {} succeeded, {} failed",
          outcomes.size() - failed,
          failed);
      return outcomes;
    } finally {
      pool.shutdownNow();
    }
  }

  private ClassificationOutcome classifyOne(String runId, EventRecord event, RunControl control) {
    if (!control.isActive()) {
      return ClassificationOutcome.failure(event.id(), NOT_DISPATCHED);
    }
    try {
      AnalysisResult result = classifier.classify(event, control);
      writer.writeResult(runId, ResultWriter.ON_DEMAND, result);
      return ClassificationOutcome.success(result);
    } catch (RunCancelledException e) {
      return ClassificationOutcome.failure(event.id(), "cancelled: " + e.getMessage());
    } catch (RuntimeException e) {
      log.warn("Event {} failed classification: {}", event.id(), ExceptionUtil.describe(e));
      return ClassificationOutcome.failure(event.id(), ExceptionUtil.describe(e));
    }
  }

  private static ClassificationOutcome await(
      EventRecord event, Future<ClassificationOutcome> future) {
    try {
      return future.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new RunCancelledException("Interrupted while waiting for on-demand results");
    } catch (ExecutionException e) {
      return ClassificationOutcome.failure(event.id(), ExceptionUtil.describe(e.getCause()));
    }
  }

  private static ThreadFactory threadFactory(String runId) {
    AtomicInteger n = new AtomicInteger();
    return r -> {
      Thread t = new Thread(r, "maki-ondemand-" + runId + "-" + n.incrementAndGet());
      t.setDaemon(true);
      return t;
    };
  }
}
