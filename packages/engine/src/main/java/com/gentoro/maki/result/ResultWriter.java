package com.gentoro.maki.result;

import com.gentoro.maki.storage.ObjectStore;
import com.gentoro.maki.utility.JacksonUtility;
import com.gentoro.maki.utility.StringUtility;

/** Persists run artifacts under {@code runs/<runId>/} in the object store. */
public class ResultWriter {
  public static final String ON_DEMAND = "ondemand";
  public static final String BATCH = "batch";

  private final ObjectStore store;

  public ResultWriter(ObjectStore store) {
    this.store = store;
  }

  public static String runPrefix(String runId) {
    return "runs/" + runId + "/";
  }

  public static String resultKey(String runId, String path, String eventId) {
    return runPrefix(runId) + path + "/events/" + StringUtility.storageKey(eventId) + ".json";
  }

  public static String summaryKey(String runId) {
    return runPrefix(runId) + "summary.json";
  }

  public static String outcomeKey(String runId) {
    return runPrefix(runId) + "outcome.json";
  }

  /**
   * @param path {@link #ON_DEMAND} or {@link #BATCH}
   * @return key of the written artifact
   */
  public String writeResult(String runId, String path, AnalysisResult result) {
    String key = resultKey(runId, path, result.eventId());
    store.put(key, JacksonUtility.toJson(result));
    return key;
  }

  public String writeSummary(String runId, AggregateSummary summary) {
    String key = summaryKey(runId);
    store.put(key, JacksonUtility.toJson(summary));
    return key;
  }

  public String writeOutcome(String runId, Object outcome) {
    String key = outcomeKey(runId);
    store.put(key, JacksonUtility.toJson(outcome));
    return key;
  }
}
