package com.gentoro.maki.storage;

import com.gentoro.maki.exception.IoException;
import com.gentoro.maki.exception.ValidationException;
import com.gentoro.maki.logging.LoggingService;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;

/** {@link ObjectStore} backed by a directory tree; each key maps to one file below the root. */
public class FileSystemObjectStore implements ObjectStore {
  private static final Logger log = LoggingService.getLogger(FileSystemObjectStore.class);

  private final Path root;

  public FileSystemObjectStore(Path root) {
    this.root = root.toAbsolutePath().normalize();
    try {
      Files.createDirectories(this.root);
    } catch (IOException e) {
      throw new IoException("Cannot create object store root " + this.root, e);
    }
  }

  public Path root() {
    return root;
  }

  @Override
  public void put(String key, String content) {
    Path target = resolve(key);
    try {
      Files.createDirectories(target.getParent());
      Path tmp = Files.createTempFile(target.getParent(), ".tmp-", ".part");
      Files.writeString(tmp, content, StandardCharsets.UTF_8);
      try {
        Files.move(
            tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
      }
      log.trace("Stored object {} ({} chars)", key, content.length());
    } catch (IOException e) {
      throw new IoException("Failed to write object " + key, e);
    }
  }

  @Override
  public Optional<String> get(String key) {
    Path target = resolve(key);
    try {
      return Optional.of(Files.readString(target, StandardCharsets.UTF_8));
    } catch (NoSuchFileException e) {
      return Optional.empty();
    } catch (IOException e) {
      throw new IoException("Failed to read object " + key, e);
    }
  }

  @Override
  public boolean exists(String key) {
    return Files.isRegularFile(resolve(key));
  }

  @Override
  public List<String> list(String prefix) {
    if (!Files.isDirectory(root)) return List.of();
    try (Stream<Path> files = Files.walk(root)) {
      return files
          .filter(Files::isRegularFile)
          .map(this::keyOf)
          .filter(k -> !k.contains("/.tmp-"))
          .filter(k -> k.startsWith(prefix))
          .sorted()
          .collect(Collectors.toList());
    } catch (IOException e) {
      throw new IoException("Failed to list objects under " + prefix, e);
    }
  }

  @Override
  public boolean delete(String key) {
    try {
      return Files.deleteIfExists(resolve(key));
    } catch (IOException e) {
      throw new IoException("Failed to delete object " + key, e);
    }
  }

  @Override
  public int deletePrefix(String prefix) {
    List<String> keys = list(prefix);
    int removed = 0;
    for (String key : keys) {
      if (delete(key)) removed++;
    }
    pruneEmptyDirectories();
    return removed;
  }

  private void pruneEmptyDirectories() {
    List<Path> dirs = new ArrayList<>();
    try (Stream<Path> walk = Files.walk(root)) {
      walk.filter(Files::isDirectory).filter(p -> !p.equals(root)).forEach(dirs::add);
    } catch (IOException e) {
      log.debug("Could not scan {} for empty directories", root, e);
      return;
    }
    dirs.sort(Comparator.comparingInt(Path::getNameCount).reversed());
    for (Path dir : dirs) {
      try (Stream<Path> entries = Files.list(dir)) {
        if (entries.findAny().isEmpty()) {
          Files.deleteIfExists(dir);
        }
      } catch (IOException e) {
        log.debug("Could not prune directory {}", dir, e);
      }
    }
  }

  private Path resolve(String key) {
    if (key == null || key.isBlank() || key.startsWith("/")) {
      throw new ValidationException("Invalid object key: " + key);
    }
    Path p = root.resolve(key).normalize();
    if (!p.startsWith(root) || p.equals(root)) {
      throw new ValidationException("Object key escapes the store root: " + key);
    }
    return p;
  }

  private String keyOf(Path file) {
    return root.relativize(file).toString().replace('\\', '/');
  }
}
