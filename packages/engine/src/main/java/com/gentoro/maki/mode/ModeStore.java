package com.gentoro.maki.mode;

import java.util.Optional;

/** Named, persisted mode parameter shared by every run. */
public interface ModeStore {

  /** Raw stored value, empty when the parameter was never written. */
  Optional<String> read();

  /** Operator action; the engine itself never calls this. */
  void write(Mode mode);
}
