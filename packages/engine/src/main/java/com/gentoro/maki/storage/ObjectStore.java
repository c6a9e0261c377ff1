package com.gentoro.maki.storage;

import java.util.List;
import java.util.Optional;

/**
 * Opaque key/value store for run artifacts and batch manifests. Keys are {@code /}-separated
 * relative paths such as {@code runs/<runId>/summary.json}.
 */
public interface ObjectStore {

  void put(String key, String content);

  Optional<String> get(String key);

  boolean exists(String key);

  /** Keys starting with {@code prefix}, sorted. */
  List<String> list(String prefix);

  /** @return true when an object was removed */
  boolean delete(String key);

  /** @return number of objects removed */
  int deletePrefix(String prefix);
}
