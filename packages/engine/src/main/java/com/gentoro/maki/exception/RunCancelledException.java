package com.gentoro.maki.exception;

import java.util.Map;

/** The run was cancelled by the operator or ran past its overall deadline. */
public class RunCancelledException extends MakiException {
  public RunCancelledException(String message) {
    super(MakiErrorCode.CANCELLED, message);
  }

  private RunCancelledException(String message, long budgetMs) {
    super(MakiErrorCode.DEADLINE_EXCEEDED, message, Map.of("budgetMs", budgetMs));
  }

  public static RunCancelledException deadlineExceeded(long budgetMs) {
    return new RunCancelledException(
        "Run exceeded its deadline of %d ms".formatted(budgetMs), budgetMs);
  }

  public boolean isDeadlineExceeded() {
    return getCode() == MakiErrorCode.DEADLINE_EXCEEDED;
  }
}
