package com.gentoro.maki.routing;

import com.gentoro.maki.exception.ValidationException;

/**
 * Chooses the processing path from the event count: nothing to do for zero events, bulk batch
 * processing at or above the threshold, per-event calls below it.
 */
public class VolumeRouter {
  private final long threshold;

  public VolumeRouter(long threshold) {
    validateThreshold(threshold);
    this.threshold = threshold;
  }

  public long threshold() {
    return threshold;
  }

  public Route route(long eventCount) {
    return route(eventCount, threshold);
  }

  public static Route route(long eventCount, long threshold) {
    if (eventCount < 0) {
      throw new ValidationException("Event count must not be negative: " + eventCount);
    }
    validateThreshold(threshold);
    if (eventCount == 0) return Route.NO_EVENTS;
    return eventCount >= threshold ? Route.BATCH : Route.ON_DEMAND;
  }

  private static void validateThreshold(long threshold) {
    if (threshold <= 0) {
      throw new ValidationException("Routing threshold must be positive: " + threshold);
    }
  }
}
