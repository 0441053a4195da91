package com.acme.shove.exec;

import com.acme.shove.config.ShoveConfig;
import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Executes invocations through the configured shell ({@code <shell> -c <invocation>}) as a child
 * process. Standard error is merged into standard output; the merged stream is captured in a
 * temporary file so a chatty command can never block on a full pipe.
 */
public class ProcessCommandExecutor implements CommandExecutor {
  private static final Logger log = LoggerFactory.getLogger(ProcessCommandExecutor.class);

  static final String TIMED_OUT = "timed out";
  static final String INTERRUPTED = "interrupted";

  private final String shell;
  private final Duration timeout;

  public ProcessCommandExecutor(ShoveConfig config) {
    this(config.getShell(), config.isExecutionBounded() ? config.getExecutionTimeout() : Duration.ZERO);
  }

  ProcessCommandExecutor(String shell, Duration timeout) {
    this.shell = shell;
    this.timeout = timeout;
  }

  @Override
  public ExecutionResult run(String invocation, Path workingDirectory) {
    Path capture = createCaptureFile();
    try {
      Process process;
      try {
        process =
            new ProcessBuilder(List.of(shell, "-c", invocation))
                .directory(workingDirectory.toFile())
                .redirectErrorStream(true)
                .redirectInput(ProcessBuilder.Redirect.from(nullDevice()))
                .redirectOutput(capture.toFile())
                .start();
      } catch (IOException e) {
        String msg = "Failed to start `" + invocation + "` in " + workingDirectory + ": " + e.getMessage();
        log.error(msg);
        return ExecutionResult.notExecuted(msg);
      }

      log.debug("Started pid={} for `{}`", process.pid(), invocation);
      try {
        if (!awaitExit(process)) {
          log.warn("`{}` did not finish within {}, killing pid={}", invocation, timeout, process.pid());
          destroy(process);
          return ExecutionResult.notExecuted(TIMED_OUT);
        }
      } catch (InterruptedException e) {
        log.warn("Interrupted while waiting for `{}`, killing pid={}", invocation, process.pid());
        destroy(process);
        Thread.currentThread().interrupt();
        return ExecutionResult.notExecuted(INTERRUPTED);
      }

      return new ExecutionResult(process.exitValue(), readCapture(capture));
    } finally {
      deleteCapture(capture);
    }
  }

  private boolean awaitExit(Process process) throws InterruptedException {
    if (timeout.isZero()) {
      process.waitFor();
      return true;
    }
    return process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  private static void destroy(Process process) {
    process.descendants().forEach(ProcessHandle::destroyForcibly);
    process.destroyForcibly();
  }

  private static Path createCaptureFile() {
    try {
      return Files.createTempFile("shove-", ".out");
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to create output capture file", e);
    }
  }

  private static String readCapture(Path capture) {
    try {
      return new String(Files.readAllBytes(capture), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read captured output " + capture, e);
    }
  }

  private static void deleteCapture(Path capture) {
    try {
      Files.deleteIfExists(capture);
    } catch (IOException e) {
      log.warn("Could not delete output capture file {}", capture, e);
    }
  }

  private static File nullDevice() {
    return new File(System.getProperty("os.name").startsWith("Windows") ? "NUL" : "/dev/null");
  }
}
