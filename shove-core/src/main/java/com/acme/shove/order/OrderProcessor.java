package com.acme.shove.order;

import com.acme.shove.exec.CommandExecutor;
import com.acme.shove.exec.ExecutionResult;
import com.acme.shove.resolve.CommandResolver;
import com.acme.shove.resolve.ResolutionException;
import com.acme.shove.resolve.ResolvedCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs an order: resolves its command against the project manifest, then executes it.
 *
 * <p>Resolution failures are not thrown. They come back as a result with return code 1 and an
 * explanatory output, exactly like a command that ran and failed.
 */
public class OrderProcessor {
  private static final Logger log = LoggerFactory.getLogger(OrderProcessor.class);

  private final CommandResolver resolver;
  private final CommandExecutor executor;

  public OrderProcessor(CommandResolver resolver, CommandExecutor executor) {
    this.resolver = resolver;
    this.executor = executor;
  }

  public ExecutionResult process(Order order) {
    ResolvedCommand command;
    try {
      command = resolver.resolve(order.project(), order.command());
    } catch (ResolutionException e) {
      if (e.getKind() == ResolutionException.Kind.MANIFEST_UNREADABLE) {
        log.error(e.getMessage());
      } else {
        log.warn(e.getMessage());
      }
      return ExecutionResult.notExecuted(e.getMessage());
    }

    ExecutionResult result = executor.run(command.invocation(), command.workingDirectory());
    log.info("Finished running {} - returned {}", command.name(), result.returnCode());
    return result;
  }
}
