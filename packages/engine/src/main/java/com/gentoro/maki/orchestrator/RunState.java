package com.gentoro.maki.orchestrator;

/** States of one orchestration run. FAILED, NO_EVENTS and COMPLETED are absorbing. */
public enum RunState {
  INIT("Starting run"),
  MODE_RESOLVED("Mode resolved"),
  PRECONDITIONS_CHECKED("Preconditions checked"),
  ROUTED("Events counted and routed"),
  ON_DEMAND_RUNNING("Classifying events on demand"),
  BATCH_RUNNING("Classifying events in a batch job"),
  AGGREGATING("Aggregating results"),
  COMPLETED("Completed"),
  FAILED("Failed"),
  NO_EVENTS("No events");

  private final String label;

  RunState(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED || this == NO_EVENTS;
  }
}
