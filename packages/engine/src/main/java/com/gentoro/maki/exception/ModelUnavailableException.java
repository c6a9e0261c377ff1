package com.gentoro.maki.exception;

import java.util.List;
import java.util.Map;

/** One or more inference backends required by the run are not enabled or not reachable. */
public class ModelUnavailableException extends MakiException {
  public ModelUnavailableException(List<String> models) {
    super(
        MakiErrorCode.FAILED_PRECONDITION,
        "Inference models not enabled: " + String.join(", ", models),
        Map.of("models", List.copyOf(models)));
  }
}
