package com.acme.shove.order;

import com.acme.shove.exec.ExecutionResult;
import com.acme.shove.spi.ResultPublisher;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handles a single inbound message: decode, process, then publish the result to the order's log
 * queue. Messages that do not decode are dropped without a reply.
 */
public class OrderHandler {
  private static final Logger log = LoggerFactory.getLogger(OrderHandler.class);

  private final OrderDecoder decoder;
  private final OrderProcessor processor;

  public OrderHandler(OrderDecoder decoder, OrderProcessor processor) {
    this.decoder = decoder;
    this.processor = processor;
  }

  /**
   * @return the published result, or empty when the message was dropped
   * @throws com.acme.shove.core.ResultPublishException if the result could not be published
   */
  public Optional<ResultMessage> handle(byte[] body, ResultPublisher publisher) {
    Optional<Order> decoded = decoder.decode(body);
    if (decoded.isEmpty()) {
      return Optional.empty();
    }

    Order order = decoded.get();
    log.info("Executing order: {}", order);
    ExecutionResult result = processor.process(order);

    ResultMessage message = ResultMessage.of(order, result);
    publisher.declareQueue(order.logQueue());
    publisher.publish(order.logQueue(), message.toJsonBytes());
    log.debug("Published result for log_key={} to {}", order.logKey(), order.logQueue());
    return Optional.of(message);
  }
}
