package com.gentoro.maki.mode;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.maki.exception.ConfigException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ModeSelectorTest {

  @TempDir Path dir;

  @Test
  @DisplayName("Stored value is read on every resolve")
  void readsStoreEachTime() {
    FileModeStore store = new FileModeStore(dir, "maki-mode");
    ModeSelector selector = new ModeSelector(store);

    store.write(Mode.CASES);
    assertEquals(Mode.CASES, selector.resolve());

    store.write(Mode.HEALTH);
    assertEquals(Mode.HEALTH, selector.resolve());
  }

  @Test
  void valueIsCaseAndWhitespaceInsensitive() throws Exception {
    Files.writeString(dir.resolve("maki-mode"), "  Health \n");

    assertEquals(Mode.HEALTH, new ModeSelector(new FileModeStore(dir, "maki-mode")).resolve());
  }

  @Test
  @DisplayName("Missing or unknown values fail without a fallback")
  void failsWithoutFallback() throws Exception {
    ModeSelector selector = new ModeSelector(new FileModeStore(dir, "maki-mode"));
    assertThrows(ConfigException.class, selector::resolve);

    Files.writeString(dir.resolve("maki-mode"), "billing");
    ConfigException e = assertThrows(ConfigException.class, selector::resolve);
    assertTrue(e.getMessage().contains("billing"));
  }

  @Test
  void fallbackIsUsedWhenConfigured() {
    ModeStore empty =
        new ModeStore() {
          @Override
          public Optional<String> read() {
            return Optional.empty();
          }

          @Override
          public void write(Mode mode) {
            throw new UnsupportedOperationException();
          }
        };

    assertEquals(Mode.CASES, new ModeSelector(empty, Mode.CASES).resolve());
  }
}
