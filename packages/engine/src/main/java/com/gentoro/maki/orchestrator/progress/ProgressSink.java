package com.gentoro.maki.orchestrator.progress;

import java.util.Map;

/**
 * Progress reporting abstraction for orchestration runs.
 *
 * <p>Decouples the engine (producer of stage events) from where they end up (logs, a UI, a test
 * recorder). Implementations must be cheap and thread-safe: on-demand workers report steps
 * concurrently.
 */
public interface ProgressSink {

  /**
   * Signal the beginning of a stage.
   *
   * @param id stable stage identifier, the name of a run state (e.g. "BATCH_RUNNING")
   * @param label human-readable label
   * @param totalWork total work units, 0 when unknown
   */
  void beginStage(String id, String label, long totalWork);

  /**
   * Report an incremental step within a stage.
   *
   * @param completed completed work units so far
   * @param attrs optional structured attributes (eventId, jobStatus, ...)
   */
  void step(String id, long completed, String message, Map<String, Object> attrs);

  void endStageOk(String id, Map<String, Object> attrs);

  /** Mark a stage as failed with a short error summary. */
  void endStageError(String id, String errorSummary, Map<String, Object> attrs);
}
