package com.gentoro.maki.mode;

import com.gentoro.maki.exception.IoException;
import com.gentoro.maki.logging.LoggingService;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Optional;
import org.slf4j.Logger;

/** Keeps the mode parameter as a one-line file named after the parameter. */
public class FileModeStore implements ModeStore {
  private static final Logger log = LoggingService.getLogger(FileModeStore.class);

  private final Path file;

  public FileModeStore(Path dir, String parameterName) {
    this.file = dir.resolve(parameterName);
  }

  @Override
  public Optional<String> read() {
    try {
      String raw = Files.readString(file, StandardCharsets.UTF_8).trim();
      return raw.isEmpty() ? Optional.empty() : Optional.of(raw);
    } catch (NoSuchFileException e) {
      return Optional.empty();
    } catch (IOException e) {
      throw new IoException("Failed to read mode parameter " + file, e);
    }
  }

  @Override
  public void write(Mode mode) {
    try {
      Files.createDirectories(file.getParent());
      Files.writeString(file, mode.value() + System.lineSeparator(), StandardCharsets.UTF_8);
      log.info("Mode parameter {} set to {}", file.getFileName(), mode);
    } catch (IOException e) {
      throw new IoException("Failed to write mode parameter " + file, e);
    }
  }
}
