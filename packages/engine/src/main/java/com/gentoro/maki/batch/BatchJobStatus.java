package com.gentoro.maki.batch;

/** Lifecycle of a batch job: BUILDING, SUBMITTED, IN_PROGRESS, then one terminal state. */
public enum BatchJobStatus {
  BUILDING,
  SUBMITTED,
  IN_PROGRESS,
  COMPLETED,
  FAILED,
  STOPPED;

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED || this == STOPPED;
  }
}
