package com.gentoro.maki.orchestrator.progress;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class ProgressRateLimiterTest {

  @Test
  void allowsFirstEventAndDeltaBasedEvents() {
    ProgressRateLimiter limiter = new ProgressRateLimiter(300, 2);

    assertTrue(limiter.tryAcquire(0, 0));
    // inside the interval and below the delta
    assertFalse(limiter.tryAcquire(100, 1));
    assertTrue(limiter.tryAcquire(150, 2));
    // interval elapsed without new work
    assertTrue(limiter.tryAcquire(500, 2));
  }

  @Test
  void zeroLimitsLetEverythingThrough() {
    ProgressRateLimiter limiter = new ProgressRateLimiter(0, 0);

    assertTrue(limiter.tryAcquire(0, 0));
    assertTrue(limiter.tryAcquire(0, 0));
    assertTrue(limiter.tryAcquire(1, 1));
  }
}
