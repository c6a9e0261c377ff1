package com.gentoro.maki.event;

import com.gentoro.maki.mode.Mode;
import java.time.Instant;
import java.util.Map;

/** Minimal surface shared by every operational event the pipeline classifies. */
public interface EventRecord {

  /** Stable identifier, unique within one source. */
  String id();

  /** Free text the classifier reads. */
  String body();

  /** When the event started or was created. */
  Instant timestamp();

  Mode mode();

  /** Identifying fields copied verbatim into the event's analysis result. */
  Map<String, Object> identity();
}
