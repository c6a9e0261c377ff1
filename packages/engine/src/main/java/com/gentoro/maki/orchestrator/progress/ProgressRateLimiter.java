package com.gentoro.maki.orchestrator.progress;

/**
 * Time and delta based rate limiter for progress updates.
 *
 * <p>An event passes if at least {@code minIntervalMs} elapsed since the last accepted event or if
 * the completed counter moved by at least {@code minDelta} units. The first event always passes.
 */
public class ProgressRateLimiter {
  private final long minIntervalMs;
  private final long minDelta;

  private long lastAcceptedAt;
  private long lastCompleted;
  private boolean primed;

  public ProgressRateLimiter(long minIntervalMs, long minDelta) {
    this.minIntervalMs = Math.max(0, minIntervalMs);
    this.minDelta = Math.max(0, minDelta);
  }

  public synchronized boolean tryAcquire(long nowMs, long completed) {
    if (primed
        && nowMs - lastAcceptedAt < minIntervalMs
        && Math.abs(completed - lastCompleted) < minDelta) {
      return false;
    }
    primed = true;
    lastAcceptedAt = nowMs;
    lastCompleted = completed;
    return true;
  }
}
