package com.gentoro.maki.orchestrator;

import com.gentoro.maki.exception.ConfigException;
import com.gentoro.maki.mode.Mode;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.ex.ConversionException;

/** Typed, validated view of the engine's configuration keys. */
public record EngineSettings(
    long runTimeoutMs,
    long routingThreshold,
    long batchMinRecords,
    long batchPollIntervalMs,
    long batchMaxWaitMs,
    boolean batchCleanupIntermediate,
    int onDemandWorkers,
    int retryMaxAttempts,
    long retryInitialDelayMs,
    long retryMaxDelayMs,
    int aggregateMaxInputChars,
    Mode modeFallback) {

  public static final long DEFAULT_RUN_TIMEOUT_MS = 3_600_000L;
  public static final long DEFAULT_THRESHOLD = 100;
  public static final long DEFAULT_MIN_RECORDS = 100;
  public static final long DEFAULT_POLL_INTERVAL_MS = 60_000L;
  public static final long DEFAULT_MAX_WAIT_MS = 3_600_000L;
  public static final int DEFAULT_WORKERS = 4;
  public static final int DEFAULT_RETRY_ATTEMPTS = 5;
  public static final long DEFAULT_RETRY_INITIAL_DELAY_MS = 1_000L;
  public static final long DEFAULT_RETRY_MAX_DELAY_MS = 30_000L;
  public static final int DEFAULT_AGGREGATE_MAX_INPUT_CHARS = 400_000;

  public EngineSettings {
    require(runTimeoutMs >= 0, "engine.run-timeout-ms must be >= 0");
    require(routingThreshold >= 1, "routing.threshold must be >= 1");
    require(batchMinRecords >= 1, "batch.min-records must be >= 1");
    require(
        routingThreshold >= batchMinRecords,
        "routing.threshold (%d) must not be below batch.min-records (%d)"
            .formatted(routingThreshold, batchMinRecords));
    require(batchPollIntervalMs >= 1, "batch.poll-interval-ms must be >= 1");
    require(batchMaxWaitMs >= batchPollIntervalMs, "batch.max-wait-ms must be >= poll interval");
    require(onDemandWorkers >= 1, "ondemand.workers must be >= 1");
    require(retryMaxAttempts >= 1, "retry.max-attempts must be >= 1");
    require(retryInitialDelayMs >= 0, "retry.initial-delay-ms must be >= 0");
    require(
        retryMaxDelayMs >= retryInitialDelayMs,
        "retry.max-delay-ms must be >= retry.initial-delay-ms");
    require(aggregateMaxInputChars >= 1_000, "aggregate.max-input-chars must be >= 1000");
  }

  public static EngineSettings from(Configuration cfg) {
    try {
      String fallback = cfg.getString("mode.fallback", null);
      Mode modeFallback = null;
      if (fallback != null && !fallback.isBlank()) {
        modeFallback =
            Mode.fromValue(fallback)
                .orElseThrow(() -> new ConfigException("Unknown mode.fallback: " + fallback));
      }
      return new EngineSettings(
          cfg.getLong("engine.run-timeout-ms", DEFAULT_RUN_TIMEOUT_MS),
          cfg.getLong("routing.threshold", DEFAULT_THRESHOLD),
          cfg.getLong("batch.min-records", DEFAULT_MIN_RECORDS),
          cfg.getLong("batch.poll-interval-ms", DEFAULT_POLL_INTERVAL_MS),
          cfg.getLong("batch.max-wait-ms", DEFAULT_MAX_WAIT_MS),
          cfg.getBoolean("batch.cleanup-intermediate", true),
          cfg.getInt("ondemand.workers", DEFAULT_WORKERS),
          cfg.getInt("retry.max-attempts", DEFAULT_RETRY_ATTEMPTS),
          cfg.getLong("retry.initial-delay-ms", DEFAULT_RETRY_INITIAL_DELAY_MS),
          cfg.getLong("retry.max-delay-ms", DEFAULT_RETRY_MAX_DELAY_MS),
          cfg.getInt("aggregate.max-input-chars", DEFAULT_AGGREGATE_MAX_INPUT_CHARS),
          modeFallback);
    } catch (ConversionException e) {
      throw new ConfigException("Invalid engine configuration value: " + e.getMessage(), e);
    }
  }

  public RetryPolicy retryPolicy() {
    return new RetryPolicy(retryMaxAttempts, retryInitialDelayMs, retryMaxDelayMs);
  }

  private static void require(boolean condition, String message) {
    if (!condition) {
      throw new ConfigException(message);
    }
  }
}
