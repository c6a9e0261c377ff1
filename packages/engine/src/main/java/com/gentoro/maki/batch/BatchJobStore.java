package com.gentoro.maki.batch;

import com.gentoro.maki.mode.Mode;
import java.util.List;
import java.util.Optional;

/** Durable registry of batch jobs, read on every run without in-process caching. */
public interface BatchJobStore {

  void save(BatchJob job);

  Optional<BatchJob> find(String jobId);

  /** Jobs of one mode, oldest first. */
  List<BatchJob> findByMode(Mode mode);
}
