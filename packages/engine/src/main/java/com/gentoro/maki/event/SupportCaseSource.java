package com.gentoro.maki.event;

import com.gentoro.maki.mode.Mode;
import java.nio.file.Path;

public class SupportCaseSource extends JsonDirectoryEventSource<SupportCase> {
  public SupportCaseSource(Path dir) {
    super(dir, SupportCase.class);
  }

  @Override
  public Mode mode() {
    return Mode.CASES;
  }
}
