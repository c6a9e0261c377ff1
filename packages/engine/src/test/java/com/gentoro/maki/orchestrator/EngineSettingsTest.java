package com.gentoro.maki.orchestrator;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.maki.exception.ConfigException;
import com.gentoro.maki.mode.Mode;
import org.apache.commons.configuration2.BaseConfiguration;
import org.apache.commons.configuration2.Configuration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("EngineSettings configuration")
class EngineSettingsTest {

  @Test
  @DisplayName("Defaults apply when nothing is configured")
  void defaults() {
    EngineSettings settings = EngineSettings.from(new BaseConfiguration());

    assertEquals(100, settings.routingThreshold());
    assertEquals(100, settings.batchMinRecords());
    assertEquals(EngineSettings.DEFAULT_POLL_INTERVAL_MS, settings.batchPollIntervalMs());
    assertTrue(settings.batchCleanupIntermediate());
    assertNull(settings.modeFallback());
  }

  @Test
  @DisplayName("Threshold below the batch minimum is rejected")
  void thresholdBelowMinimum() {
    Configuration cfg = new BaseConfiguration();
    cfg.setProperty("routing.threshold", 50);
    cfg.setProperty("batch.min-records", 100);

    ConfigException e = assertThrows(ConfigException.class, () -> EngineSettings.from(cfg));
    assertTrue(e.getMessage().contains("routing.threshold"));
  }

  @Test
  void nonNumericValueIsConfigError() {
    Configuration cfg = new BaseConfiguration();
    cfg.setProperty("routing.threshold", "many");

    assertThrows(ConfigException.class, () -> EngineSettings.from(cfg));
  }

  @Test
  void fallbackModeIsParsed() {
    Configuration cfg = new BaseConfiguration();
    cfg.setProperty("mode.fallback", "health");

    assertEquals(Mode.HEALTH, EngineSettings.from(cfg).modeFallback());

    cfg.setProperty("mode.fallback", "nope");
    assertThrows(ConfigException.class, () -> EngineSettings.from(cfg));
  }

  @Test
  void retryPolicyFollowsSettings() {
    Configuration cfg = new BaseConfiguration();
    cfg.setProperty("retry.max-attempts", 2);
    cfg.setProperty("retry.initial-delay-ms", 10);
    cfg.setProperty("retry.max-delay-ms", 15);

    RetryPolicy policy = EngineSettings.from(cfg).retryPolicy();

    assertEquals(2, policy.maxAttempts());
    assertEquals(15, policy.delayAfter(2));
  }
}
