package com.gentoro.maki.batch;

import com.gentoro.maki.exception.IoException;
import com.gentoro.maki.exception.SerializationException;
import com.gentoro.maki.logging.LoggingService;
import com.gentoro.maki.mode.Mode;
import com.gentoro.maki.utility.JacksonUtility;
import com.gentoro.maki.utility.StringUtility;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import org.slf4j.Logger;

/** One JSON document per job in a directory. */
public class FileBatchJobStore implements BatchJobStore {
  private static final Logger log = LoggingService.getLogger(FileBatchJobStore.class);

  private final Path dir;

  public FileBatchJobStore(Path dir) {
    this.dir = dir;
  }

  @Override
  public synchronized void save(BatchJob job) {
    Path target = file(job.jobId());
    try {
      Files.createDirectories(dir);
      Path tmp = Files.createTempFile(dir, ".job-", ".tmp");
      Files.writeString(tmp, JacksonUtility.toJson(job), StandardCharsets.UTF_8);
      Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
    } catch (IOException e) {
      throw new IoException("Failed to save batch job " + job.jobId(), e);
    }
  }

  @Override
  public Optional<BatchJob> find(String jobId) {
    Path f = file(jobId);
    return Files.isRegularFile(f) ? Optional.of(read(f)) : Optional.empty();
  }

  @Override
  public List<BatchJob> findByMode(Mode mode) {
    if (!Files.isDirectory(dir)) return List.of();
    List<BatchJob> jobs = new ArrayList<>();
    try (Stream<Path> files = Files.list(dir)) {
      for (Path f : files.filter(p -> p.getFileName().toString().endsWith(".json")).toList()) {
        try {
          BatchJob job = read(f);
          if (job.mode() == mode) jobs.add(job);
        } catch (SerializationException e) {
          log.warn("Ignoring unreadable batch job record {}: {}", f.getFileName(), e.getMessage());
        }
      }
    } catch (IOException e) {
      throw new IoException("Failed to list batch jobs in " + dir, e);
    }
    jobs.sort(Comparator.comparing(BatchJob::createdAt));
    return jobs;
  }

  private BatchJob read(Path f) {
    try {
      return JacksonUtility.fromJson(Files.readString(f, StandardCharsets.UTF_8), BatchJob.class);
    } catch (IOException e) {
      throw new IoException("Failed to read batch job record " + f, e);
    }
  }

  private Path file(String jobId) {
    return dir.resolve(StringUtility.storageKey(jobId) + ".json");
  }
}
