package com.gentoro.maki.orchestrator;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.maki.exception.LlmException;
import com.gentoro.maki.exception.RunCancelledException;
import com.gentoro.maki.exception.TransientInferenceException;
import com.gentoro.maki.exception.ValidationException;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RetryPolicyTest {

  @Test
  @DisplayName("Delay doubles per attempt and is capped")
  void backoffIsBoundedExponential() {
    RetryPolicy policy = new RetryPolicy(6, 100, 500);

    assertEquals(100, policy.delayAfter(1));
    assertEquals(200, policy.delayAfter(2));
    assertEquals(400, policy.delayAfter(3));
    assertEquals(500, policy.delayAfter(4));
    assertEquals(500, policy.delayAfter(10));
  }

  @Test
  @DisplayName("Transient failures are retried until the call succeeds")
  void retriesTransientFailures() {
    RetryPolicy policy = new RetryPolicy(3, 1, 2);
    AtomicInteger calls = new AtomicInteger();

    String result =
        policy.execute(
            "test",
            () -> {
              if (calls.incrementAndGet() < 3) throw new TransientInferenceException("throttled");
              return "ok";
            },
            RunControl.unbounded());

    assertEquals("ok", result);
    assertEquals(3, calls.get());
  }

  @Test
  @DisplayName("The last transient failure propagates once attempts are exhausted")
  void exhaustsAttempts() {
    RetryPolicy policy = new RetryPolicy(2, 1, 1);
    AtomicInteger calls = new AtomicInteger();

    assertThrows(
        TransientInferenceException.class,
        () ->
            policy.execute(
                "test",
                () -> {
                  calls.incrementAndGet();
                  throw new TransientInferenceException("timeout");
                },
                RunControl.unbounded()));
    assertEquals(2, calls.get());
  }

  @Test
  @DisplayName("Non-transient failures are not retried")
  void permanentFailureIsNotRetried() {
    RetryPolicy policy = new RetryPolicy(5, 1, 1);
    AtomicInteger calls = new AtomicInteger();

    assertThrows(
        LlmException.class,
        () ->
            policy.execute(
                "test",
                () -> {
                  calls.incrementAndGet();
                  throw new LlmException("bad request");
                },
                RunControl.unbounded()));
    assertEquals(1, calls.get());
  }

  @Test
  @DisplayName("A cancelled control stops retrying")
  void cancelledControlStops() {
    RetryPolicy policy = new RetryPolicy(5, 1, 1);
    RunControl control = RunControl.unbounded();
    control.cancel();

    assertThrows(RunCancelledException.class, () -> policy.execute("test", () -> "x", control));
  }

  @Test
  void rejectsInvalidArguments() {
    assertThrows(ValidationException.class, () -> new RetryPolicy(0, 1, 1));
    assertThrows(ValidationException.class, () -> new RetryPolicy(1, 10, 5));
  }
}
