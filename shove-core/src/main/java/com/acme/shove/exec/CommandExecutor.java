package com.acme.shove.exec;

import java.nio.file.Path;

/** Runs a manifest invocation to completion. */
public interface CommandExecutor {

  /**
   * Runs {@code invocation} in {@code workingDirectory} and blocks until it terminates. Failures to
   * start the command are reported as a result with return code 1, never thrown.
   */
  ExecutionResult run(String invocation, Path workingDirectory);
}
