package com.acme.shove.spi;

/** Broker-side operations needed to deliver result messages. */
public interface ResultPublisher {

  /** Makes sure a durable queue with this name exists. Declaring an existing queue is a no-op. */
  void declareQueue(String queue);

  /** Publishes a message body to the named queue. */
  void publish(String queue, byte[] body);
}
