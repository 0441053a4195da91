package com.acme.shove.exec;

/**
 * Outcome of one order: the process exit code and its combined stdout/stderr.
 *
 * <p>Return code {@value #NOT_EXECUTED} is also used when the command could not be executed at all,
 * in which case {@code output} explains why.
 */
public record ExecutionResult(int returnCode, String output) {
  public static final int SUCCESS = 0;
  public static final int NOT_EXECUTED = 1;

  public ExecutionResult {
    output = output == null ? "" : output;
  }

  public static ExecutionResult notExecuted(String reason) {
    return new ExecutionResult(NOT_EXECUTED, reason);
  }

  boolean isSuccess() {
    return returnCode == SUCCESS;
  }
}
