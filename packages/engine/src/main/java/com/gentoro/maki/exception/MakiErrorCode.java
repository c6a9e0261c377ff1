package com.gentoro.maki.exception;

/**
 * Canonical error codes for MAKI. Inspired by Google/RPC style codes. Codes are stable and are
 * written into run outcomes, so downstream monitors can branch on them.
 */
public enum MakiErrorCode {
  // Generic
  UNKNOWN,
  INVALID_ARGUMENT,
  FAILED_PRECONDITION,
  NOT_FOUND,
  ABORTED,
  CANCELLED,
  DEADLINE_EXCEEDED,
  UNAVAILABLE,

  // I/O and configuration
  CONFIGURATION_ERROR,
  IO_ERROR,
  SERIALIZATION_ERROR,

  // Domain specific
  PROMPT_ERROR,
  LLM_ERROR,
  BATCH_JOB_ERROR,
}
