package com.gentoro.maki.gate;

import com.gentoro.maki.exception.JobConflictException;
import com.gentoro.maki.exception.MakiException;
import com.gentoro.maki.exception.ModelUnavailableException;
import com.gentoro.maki.exception.StateException;
import com.gentoro.maki.mode.Mode;
import java.util.List;

/** Outcome of the precondition check: the run may proceed, or it is blocked with a reason. */
public sealed interface GateDecision permits GateDecision.Ready, GateDecision.Blocked {
  String MODEL_UNAVAILABLE = "model-unavailable";
  String JOB_IN_PROGRESS = "job-in-progress";

  static GateDecision ready() {
    return Ready.INSTANCE;
  }

  static GateDecision modelUnavailable(List<String> models) {
    return new Blocked(MODEL_UNAVAILABLE, null, List.copyOf(models), null);
  }

  static GateDecision jobInProgress(Mode mode, String jobId) {
    return new Blocked(JOB_IN_PROGRESS, mode, List.of(), jobId);
  }

  default boolean isReady() {
    return this instanceof Ready;
  }

  /** Exception form of a blocked decision. */
  MakiException toException();

  final class Ready implements GateDecision {
    private static final Ready INSTANCE = new Ready();

    private Ready() {}

    @Override
    public MakiException toException() {
      throw new StateException("A ready gate decision has no exception form");
    }

    @Override
    public String toString() {
      return "Ready";
    }
  }

  /**
   * @param unavailableModels set for {@link #MODEL_UNAVAILABLE}
   * @param jobId the in-flight job for {@link #JOB_IN_PROGRESS}
   */
  record Blocked(String reason, Mode mode, List<String> unavailableModels, String jobId)
      implements GateDecision {
    @Override
    public MakiException toException() {
      if (MODEL_UNAVAILABLE.equals(reason)) {
        return new ModelUnavailableException(unavailableModels);
      }
      return new JobConflictException(String.valueOf(mode), jobId);
    }
  }
}
