package com.gentoro.maki.event;

import com.gentoro.maki.mode.Mode;
import java.nio.file.Path;

public class HealthEventSource extends JsonDirectoryEventSource<HealthEvent> {
  public HealthEventSource(Path dir) {
    super(dir, HealthEvent.class);
  }

  @Override
  public Mode mode() {
    return Mode.HEALTH;
  }
}
