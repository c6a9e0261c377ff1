package com.gentoro.maki.routing;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.maki.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class VolumeRouterTest {

  @ParameterizedTest(name = "{0} events with threshold {1} -> {2}")
  @CsvSource({
    "0, 100, NO_EVENTS",
    "1, 100, ON_DEMAND",
    "99, 100, ON_DEMAND",
    "100, 100, BATCH",
    "150, 100, BATCH",
    "1, 1, BATCH"
  })
  void routesByVolume(long count, long threshold, Route expected) {
    assertEquals(expected, VolumeRouter.route(count, threshold));
  }

  @Test
  @DisplayName("Configured threshold is used by the instance method")
  void instanceUsesThreshold() {
    VolumeRouter router = new VolumeRouter(10);

    assertEquals(Route.ON_DEMAND, router.route(9));
    assertEquals(Route.BATCH, router.route(10));
  }

  @Test
  void rejectsInvalidInput() {
    assertThrows(ValidationException.class, () -> VolumeRouter.route(-1, 100));
    assertThrows(ValidationException.class, () -> new VolumeRouter(0));
  }
}
