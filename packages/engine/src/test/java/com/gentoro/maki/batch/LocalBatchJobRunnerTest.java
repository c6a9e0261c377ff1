package com.gentoro.maki.batch;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.maki.exception.BatchJobException;
import com.gentoro.maki.exception.NotFoundException;
import com.gentoro.maki.model.LlmClient;
import com.gentoro.maki.storage.FileSystemObjectStore;
import com.gentoro.maki.support.FakeLlmClient;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LocalBatchJobRunnerTest {

  @TempDir Path dir;

  private FileSystemObjectStore store;
  private LocalBatchJobRunner runner;

  @BeforeEach
  void setUp() {
    store = new FileSystemObjectStore(dir);
    FakeLlmClient llm =
        new FakeLlmClient(
            "light",
            m -> {
              String user = FakeLlmClient.userText(m);
              if (user.contains("boom")) throw new IllegalStateException("model error");
              return "echo " + user;
            });
    runner = new LocalBatchJobRunner(store, llm, 2);
  }

  @AfterEach
  void tearDown() {
    runner.close();
  }

  private String manifest(String... users) {
    List<BatchManifest.Entry> entries = new ArrayList<>();
    for (int i = 0; i < users.length; i++) {
      entries.add(
          new BatchManifest.Entry(
              "r" + i,
              BatchManifest.ModelInput.of(
                  List.of(LlmClient.Message.system("sys"), LlmClient.Message.user(users[i])))));
    }
    return BatchManifest.encode(entries);
  }

  private RunnerJobState awaitTerminal(String runnerJobId) throws InterruptedException {
    for (int i = 0; i < 500; i++) {
      RunnerJobState state = runner.describe(runnerJobId);
      if (state.status().isTerminal()) return state;
      Thread.sleep(10);
    }
    fail("job did not finish");
    return null;
  }

  @Test
  void processesEveryRecordAndWritesOutput() throws Exception {
    store.put("in.jsonl", manifest("a", "boom", "c"));

    String id = runner.submit("job", "in.jsonl", "out.jsonl");
    RunnerJobState state = awaitTerminal(id);

    assertEquals(BatchJobStatus.COMPLETED, state.status());
    List<BatchManifest.OutputEntry> out =
        BatchManifest.decodeOutput(store.get("out.jsonl").orElseThrow());
    assertEquals(3, out.size());
    assertEquals("echo a", out.get(0).modelOutput());
    assertNull(out.get(1).modelOutput());
    assertTrue(out.get(1).error().contains("model error"));
    assertEquals("r2", out.get(2).recordId());
  }

  @Test
  void rejectsManifestsBelowMinimum() {
    store.put("in.jsonl", manifest("only one"));

    assertThrows(BatchJobException.class, () -> runner.submit("job", "in.jsonl", "out.jsonl"));
  }

  @Test
  void rejectsMissingManifest() {
    assertThrows(BatchJobException.class, () -> runner.submit("job", "absent", "out.jsonl"));
  }

  @Test
  void unknownJobIsNotFound() {
    assertThrows(NotFoundException.class, () -> runner.describe("local-nope"));
    assertThrows(NotFoundException.class, () -> runner.stop("local-nope"));
  }
}
