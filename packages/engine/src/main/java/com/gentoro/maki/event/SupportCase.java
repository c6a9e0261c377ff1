package com.gentoro.maki.event;

import com.gentoro.maki.mode.Mode;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/** A customer support case together with its communications. */
public record SupportCase(
    String caseId,
    String displayId,
    String subject,
    String status,
    String serviceCode,
    String categoryCode,
    String severityCode,
    String submittedBy,
    Instant timeCreated,
    Instant timeResolved,
    String language,
    String communications)
    implements EventRecord {

  @Override
  public String id() {
    return caseId;
  }

  @Override
  public String body() {
    StringBuilder sb = new StringBuilder();
    if (subject != null) sb.append("Subject: ").append(subject).append('\n');
    if (communications != null) sb.append(communications);
    return sb.toString().trim();
  }

  @Override
  public Instant timestamp() {
    return timeCreated;
  }

  @Override
  public Mode mode() {
    return Mode.CASES;
  }

  @Override
  public Map<String, Object> identity() {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("caseId", caseId);
    m.put("displayId", displayId);
    m.put("status", status);
    m.put("serviceCode", serviceCode);
    m.put("timeCreated", timeCreated == null ? null : timeCreated.toString());
    m.put("timeResolved", timeResolved == null ? null : timeResolved.toString());
    m.put("submittedBy", submittedBy);
    return m;
  }
}
