package com.gentoro.maki.orchestrator;

import com.gentoro.maki.exception.TransientInferenceException;
import com.gentoro.maki.exception.ValidationException;
import com.gentoro.maki.logging.LoggingService;
import java.util.function.Supplier;
import org.slf4j.Logger;

/**
 * Exponential backoff around inference calls. Only {@link TransientInferenceException} is
 * retried; every other failure propagates immediately. The delay starts at {@code initialDelayMs},
 * doubles after each failed attempt and never exceeds {@code maxDelayMs}.
 */
public final class RetryPolicy {
  private static final Logger log = LoggingService.getLogger(RetryPolicy.class);

  private final int maxAttempts;
  private final long initialDelayMs;
  private final long maxDelayMs;

  public RetryPolicy(int maxAttempts, long initialDelayMs, long maxDelayMs) {
    if (maxAttempts < 1) {
      throw new ValidationException("maxAttempts must be at least 1");
    }
    if (initialDelayMs < 0 || maxDelayMs < initialDelayMs) {
      throw new ValidationException("Retry delays must satisfy 0 <= initial <= max");
    }
    this.maxAttempts = maxAttempts;
    this.initialDelayMs = initialDelayMs;
    this.maxDelayMs = maxDelayMs;
  }

  public int maxAttempts() {
    return maxAttempts;
  }

  /** Delay before attempt {@code attempt + 1}, for {@code attempt >= 1}. */
  public long delayAfter(int attempt) {
    long delay = initialDelayMs;
    for (int i = 1; i < attempt && delay < maxDelayMs; i++) {
      delay = delay * 2;
    }
    return Math.min(delay, maxDelayMs);
  }

  /**
   * Run {@code call}, retrying transient failures.
   *
   * @param operation short description for logs
   * @throws TransientInferenceException the last failure once attempts are exhausted
   */
  public <T> T execute(String operation, Supplier<T> call, RunControl control) {
    int attempt = 1;
    while (true) {
      control.checkActive();
      try {
        return call.get();
      } catch (TransientInferenceException e) {
        if (attempt >= maxAttempts) {
          log.warn("{} failed after {} attempt(s): {}", operation, attempt, e.getMessage());
          throw e;
        }
        long delay = delayAfter(attempt);
        log.info(
            "{} failed transiently (attempt {}/{}), retrying in {} ms: {}",
            operation,
            attempt,
            maxAttempts,
            delay,
            e.getMessage());
        control.sleep(delay);
        attempt++;
      }
    }
  }
}
