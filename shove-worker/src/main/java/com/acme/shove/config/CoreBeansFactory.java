package com.acme.shove.config;

import com.acme.shove.exec.CommandExecutor;
import com.acme.shove.exec.ProcessCommandExecutor;
import com.acme.shove.manifest.ProcfileParser;
import com.acme.shove.order.OrderDecoder;
import com.acme.shove.order.OrderHandler;
import com.acme.shove.order.OrderProcessor;
import com.acme.shove.resolve.CommandResolver;
import io.micronaut.context.annotation.Factory;
import jakarta.inject.Singleton;

/**
 * Factory for creating core beans with framework-specific configuration.
 *
 * <p>The core module stays free of framework dependencies; this module does the DI wiring.
 */
@Factory
public class CoreBeansFactory {

  /** Creates ShoveConfig bean from the bound shove.* properties */
  @Singleton
  public ShoveConfig shoveConfig(ShoveProperties properties) {
    return properties.toShoveConfig();
  }

  @Singleton
  public ProcfileParser procfileParser() {
    return new ProcfileParser();
  }

  @Singleton
  public CommandResolver commandResolver(ShoveConfig config, ProcfileParser parser) {
    return new CommandResolver(config, parser);
  }

  @Singleton
  public CommandExecutor commandExecutor(ShoveConfig config) {
    return new ProcessCommandExecutor(config);
  }

  @Singleton
  public OrderDecoder orderDecoder() {
    return new OrderDecoder();
  }

  @Singleton
  public OrderProcessor orderProcessor(CommandResolver resolver, CommandExecutor executor) {
    return new OrderProcessor(resolver, executor);
  }

  /** Creates the per-message pipeline used by the order consumer */
  @Singleton
  public OrderHandler orderHandler(OrderDecoder decoder, OrderProcessor processor) {
    return new OrderHandler(decoder, processor);
  }
}
