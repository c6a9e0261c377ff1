package com.gentoro.maki.storage;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.maki.exception.ValidationException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileSystemObjectStoreTest {

  @TempDir Path dir;

  @Test
  void putGetListAndDelete() {
    FileSystemObjectStore store = new FileSystemObjectStore(dir);

    store.put("runs/r1/b.json", "{}");
    store.put("runs/r1/a.json", "[]");
    store.put("runs/r2/a.json", "x");
    store.put("runs/r1/a.json", "[1]");

    assertEquals("[1]", store.get("runs/r1/a.json").orElseThrow());
    assertTrue(store.get("runs/r9/a.json").isEmpty());
    assertEquals(List.of("runs/r1/a.json", "runs/r1/b.json"), store.list("runs/r1/"));
    assertTrue(store.delete("runs/r2/a.json"));
    assertFalse(store.delete("runs/r2/a.json"));
  }

  @Test
  void deletePrefixRemovesObjectsAndEmptyDirectories() {
    FileSystemObjectStore store = new FileSystemObjectStore(dir);
    store.put("batch/j1/input/manifest.jsonl", "a");
    store.put("batch/j1/output/manifest.jsonl.out", "b");
    store.put("batch/j2/input/manifest.jsonl", "c");

    assertEquals(2, store.deletePrefix("batch/j1/"));

    assertFalse(Files.exists(dir.resolve("batch/j1")));
    assertTrue(store.exists("batch/j2/input/manifest.jsonl"));
  }

  @Test
  void keysMayNotEscapeTheRoot() {
    FileSystemObjectStore store = new FileSystemObjectStore(dir.resolve("objects"));

    assertThrows(ValidationException.class, () -> store.put("../outside.txt", "x"));
    assertThrows(ValidationException.class, () -> store.get("/etc/passwd"));
    assertThrows(ValidationException.class, () -> store.put(" ", "x"));
  }
}
