package com.gentoro.maki.orchestrator.progress;

import java.util.Map;

/** Discards every progress event. */
public class NoOpProgressSink implements ProgressSink {
  @Override
  public void beginStage(String id, String label, long totalWork) {}

  @Override
  public void step(String id, long completed, String message, Map<String, Object> attrs) {}

  @Override
  public void endStageOk(String id, Map<String, Object> attrs) {}

  @Override
  public void endStageError(String id, String errorSummary, Map<String, Object> attrs) {}
}
