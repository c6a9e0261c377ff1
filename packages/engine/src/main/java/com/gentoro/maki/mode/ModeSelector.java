package com.gentoro.maki.mode;

import com.gentoro.maki.exception.ConfigException;
import com.gentoro.maki.logging.LoggingService;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Resolves the mode for the current run from the {@link ModeStore}. The store is read on every
 * call. A missing or unknown value is a configuration error unless a fallback mode is configured.
 */
public class ModeSelector {
  private static final Logger log = LoggingService.getLogger(ModeSelector.class);

  private final ModeStore store;
  private final Mode fallback;

  public ModeSelector(ModeStore store) {
    this(store, null);
  }

  /** @param fallback mode used when the stored value is missing or unknown, may be null */
  public ModeSelector(ModeStore store, Mode fallback) {
    this.store = store;
    this.fallback = fallback;
  }

  public Mode resolve() {
    Optional<String> raw = store.read();
    if (raw.isEmpty()) {
      return fallbackOrFail("Mode parameter is not set");
    }
    Optional<Mode> mode = Mode.fromValue(raw.get());
    if (mode.isEmpty()) {
      return fallbackOrFail("Mode parameter holds an unknown value '%s'".formatted(raw.get()));
    }
    return mode.get();
  }

  private Mode fallbackOrFail(String problem) {
    if (fallback == null) {
      throw new ConfigException(problem);
    }
    log.warn("{}; falling back to configured mode '{}'", problem, fallback);
    return fallback;
  }
}
