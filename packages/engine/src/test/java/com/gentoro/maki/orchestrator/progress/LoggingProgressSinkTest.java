package com.gentoro.maki.orchestrator.progress;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.maki.utility.JacksonUtility;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.slf4j.Logger;

class LoggingProgressSinkTest {

  @Test
  void emitsStructuredLinesForStageLifecycle() throws Exception {
    Logger logger = mock(Logger.class);
    LoggingProgressSink sink = new LoggingProgressSink(logger, 0, 0);

    sink.beginStage("ON_DEMAND_RUNNING", "Classifying events on demand", 4);
    sink.step("ON_DEMAND_RUNNING", 1, "event a classified", Map.of("eventId", "a"));
    sink.endStageOk("ON_DEMAND_RUNNING", Map.of());

    ArgumentCaptor<Object> payloads = ArgumentCaptor.forClass(Object.class);
    verify(logger, times(3)).info(eq("[orchestration.progress] {}"), payloads.capture());
    List<Object> lines = payloads.getAllValues();

    JsonNode step = JacksonUtility.getJsonMapper().readTree((String) lines.get(1));
    assertEquals("ON_DEMAND_RUNNING", step.get("stageId").asText());
    assertEquals(1, step.get("completed").asLong());
    assertEquals(4, step.get("total").asLong());
    assertEquals(25, step.get("percent").asInt());
    assertEquals("running", step.get("status").asText());
    assertEquals("a", step.get("attrs").get("eventId").asText());

    JsonNode end = JacksonUtility.getJsonMapper().readTree((String) lines.get(2));
    assertEquals("ok", end.get("status").asText());
    assertEquals(100, end.get("percent").asInt());
  }

  @Test
  void stepsAreRateLimitedButStageEndsAreNot() {
    Logger logger = mock(Logger.class);
    LoggingProgressSink sink = new LoggingProgressSink(logger, 60_000, 100);

    sink.beginStage("BATCH_RUNNING", "Batch", 150);
    sink.step("BATCH_RUNNING", 1, "first", Map.of());
    sink.step("BATCH_RUNNING", 2, "second", Map.of());
    sink.step("BATCH_RUNNING", 3, "third", Map.of());
    sink.endStageError("BATCH_RUNNING", "timeout", Map.of());

    // begin, first step, error
    verify(logger, times(3)).info(eq("[orchestration.progress] {}"), anyString());
  }
}
