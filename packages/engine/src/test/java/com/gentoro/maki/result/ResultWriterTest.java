package com.gentoro.maki.result;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.maki.mode.Mode;
import com.gentoro.maki.storage.FileSystemObjectStore;
import com.gentoro.maki.utility.JacksonUtility;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("ResultWriter Tests")
class ResultWriterTest {

  @TempDir Path dir;

  private FileSystemObjectStore store;
  private ResultWriter writer;

  @BeforeEach
  void setUp() {
    store = new FileSystemObjectStore(dir);
    writer = new ResultWriter(store);
  }

  private static AnalysisResult result(String eventId, String category) {
    return new AnalysisResult(
        eventId,
        Mode.HEALTH,
        Map.of("arn", eventId),
        category,
        null,
        "summary of " + eventId,
        Sentiment.NEUTRAL,
        "No action",
        null);
  }

  @Test
  @DisplayName("Ids that sanitize to the same name keep separate artifacts")
  void idsWithSameSanitizedFormDoNotOverwriteEachOther() throws Exception {
    // Arrange
    List<String> ids =
        List.of(
            "case_1",
            "case__1",
            "arn:aws:health:us-east-1::event/EC2/1",
            "arn/aws/health/us-east-1//event:EC2:1");

    // Act
    for (int i = 0; i < ids.size(); i++) {
      writer.writeResult("r1", ResultWriter.ON_DEMAND, result(ids.get(i), "label-" + i));
    }

    // Assert
    List<String> keys = store.list("runs/r1/ondemand/events/");
    assertEquals(ids.size(), keys.size(), "Each result must be persisted under its own key");
    for (int i = 0; i < ids.size(); i++) {
      String key = ResultWriter.resultKey("r1", ResultWriter.ON_DEMAND, ids.get(i));
      JsonNode stored = JacksonUtility.getJsonMapper().readTree(store.get(key).orElseThrow());
      assertEquals(ids.get(i), stored.get("event_id").asText());
      assertEquals("label-" + i, stored.get("category").asText());
    }
  }

  @Test
  @DisplayName("Safe ids are used as the artifact name unchanged")
  void safeIdsKeepTheirName() {
    assertEquals(
        "runs/r1/batch/events/case-0001.json",
        ResultWriter.resultKey("r1", ResultWriter.BATCH, "case-0001"));
  }

  @Test
  @DisplayName("Absent fields are written as explicit nulls")
  void absentFieldsAreWrittenAsNull() throws Exception {
    String key = writer.writeResult("r1", ResultWriter.BATCH, result("case-0001", "other"));

    JsonNode stored = JacksonUtility.getJsonMapper().readTree(store.get(key).orElseThrow());

    assertTrue(stored.has("category_explanation"));
    assertTrue(stored.get("category_explanation").isNull());
    assertTrue(stored.has("suggestion_link"));
    assertTrue(stored.get("suggestion_link").isNull());
    assertEquals("Neutral", stored.get("sentiment").asText());
  }
}
