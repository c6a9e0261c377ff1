package com.gentoro.maki.event;

import com.gentoro.maki.exception.ConfigException;
import com.gentoro.maki.mode.Mode;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;
import org.apache.commons.configuration2.Configuration;

/** Maps each {@link Mode} to the source that feeds it. */
public class EventSourceRegistry {
  private final Map<Mode, EventSource> sources = new EnumMap<>(Mode.class);

  public EventSourceRegistry register(EventSource source) {
    sources.put(source.mode(), source);
    return this;
  }

  public EventSource forMode(Mode mode) {
    EventSource source = sources.get(mode);
    if (source == null) {
      throw new ConfigException("No event source registered for mode " + mode);
    }
    return source;
  }

  /** Directory sources from {@code events.cases.dir} and {@code events.health.dir}. */
  public static EventSourceRegistry fromConfiguration(Configuration cfg) {
    return new EventSourceRegistry()
        .register(new SupportCaseSource(Path.of(cfg.getString("events.cases.dir", "data/cases"))))
        .register(
            new HealthEventSource(Path.of(cfg.getString("events.health.dir", "data/health"))));
  }
}
