package com.gentoro.maki.event;

import com.gentoro.maki.mode.Mode;
import java.util.List;

/** Supplies the events of one {@link Mode}. */
public interface EventSource {

  Mode mode();

  long count();

  /** Events in a stable order. */
  List<EventRecord> list();
}
