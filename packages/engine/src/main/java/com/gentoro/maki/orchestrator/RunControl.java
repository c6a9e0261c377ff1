package com.gentoro.maki.orchestrator;

import com.gentoro.maki.exception.RunCancelledException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cancellation and wall-clock deadline for one run. Long waits go through {@link #sleep(long)} so
 * that {@link #cancel()} or the deadline ends them promptly.
 */
public final class RunControl {
  private final long budgetMs;
  private final long deadlineNanos;
  private final CountDownLatch cancelled = new CountDownLatch(1);

  private RunControl(long budgetMs) {
    this.budgetMs = budgetMs;
    this.deadlineNanos = budgetMs <= 0 ? Long.MAX_VALUE : System.nanoTime() + budgetMs * 1_000_000L;
  }

  /** Control whose deadline is {@code budgetMs} from now; 0 or less means no deadline. */
  public static RunControl withTimeout(long budgetMs) {
    return new RunControl(budgetMs);
  }

  public static RunControl unbounded() {
    return new RunControl(0);
  }

  /** Operator-triggered stop. Running calls finish; nothing new is started. */
  public void cancel() {
    cancelled.countDown();
  }

  public boolean isCancelled() {
    return cancelled.getCount() == 0;
  }

  public long remainingMs() {
    if (deadlineNanos == Long.MAX_VALUE) return Long.MAX_VALUE;
    return Math.max(0, (deadlineNanos - System.nanoTime()) / 1_000_000L);
  }

  public boolean isActive() {
    return !isCancelled() && remainingMs() > 0;
  }

  /** @throws RunCancelledException when cancelled or past the deadline */
  public void checkActive() {
    if (isCancelled()) {
      throw new RunCancelledException("Run cancelled by operator");
    }
    if (remainingMs() <= 0) {
      throw RunCancelledException.deadlineExceeded(budgetMs);
    }
  }

  /**
   * Sleep up to {@code millis}, waking early on cancellation.
   *
   * @throws RunCancelledException when cancelled or when the deadline passes during the wait
   */
  public void sleep(long millis) {
    checkActive();
    long wait = Math.min(millis, remainingMs());
    try {
      if (wait > 0) {
        cancelled.await(wait, TimeUnit.MILLISECONDS);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new RunCancelledException("Interrupted while waiting");
    }
    checkActive();
  }
}
