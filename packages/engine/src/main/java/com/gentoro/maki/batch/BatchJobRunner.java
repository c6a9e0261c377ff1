package com.gentoro.maki.batch;

/**
 * Executes a manifest of model requests outside the calling thread and writes one output line per
 * request. Job progress is observed only through {@link #describe(String)}.
 */
public interface BatchJobRunner {

  /**
   * @return the runner's own id for the submitted job
   * @throws com.gentoro.maki.exception.BatchJobException when the job is rejected
   */
  String submit(String jobName, String manifestRef, String outputRef);

  /**
   * @throws com.gentoro.maki.exception.NotFoundException when the runner does not know the job
   */
  RunnerJobState describe(String runnerJobId);

  void stop(String runnerJobId);
}
