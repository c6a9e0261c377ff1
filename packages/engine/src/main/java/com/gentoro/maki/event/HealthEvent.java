package com.gentoro.maki.event;

import com.gentoro.maki.mode.Mode;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** An infrastructure health notice and the resources it affects. */
public record HealthEvent(
    String eventArn,
    String service,
    String eventTypeCode,
    String eventTypeCategory,
    String region,
    Instant startTime,
    Instant endTime,
    Instant lastUpdatedTime,
    String statusCode,
    String description,
    List<String> affectedEntities)
    implements EventRecord {

  public HealthEvent {
    affectedEntities = affectedEntities == null ? List.of() : List.copyOf(affectedEntities);
  }

  @Override
  public String id() {
    return eventArn;
  }

  @Override
  public String body() {
    return description == null ? "" : description.trim();
  }

  @Override
  public Instant timestamp() {
    return startTime;
  }

  @Override
  public Mode mode() {
    return Mode.HEALTH;
  }

  @Override
  public Map<String, Object> identity() {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("eventArn", eventArn);
    m.put("service", service);
    m.put("eventTypeCode", eventTypeCode);
    m.put("eventTypeCategory", eventTypeCategory);
    m.put("region", region);
    m.put("startTime", startTime == null ? null : startTime.toString());
    m.put("endTime", endTime == null ? null : endTime.toString());
    m.put("lastUpdatedTime", lastUpdatedTime == null ? null : lastUpdatedTime.toString());
    m.put("statusCode", statusCode);
    m.put("affectedEntities", affectedEntities);
    return m;
  }
}
