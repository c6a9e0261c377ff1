package com.gentoro.maki.batch;

/** Status of a job as reported by the {@link BatchJobRunner}. */
public record RunnerJobState(BatchJobStatus status, String message) {}
