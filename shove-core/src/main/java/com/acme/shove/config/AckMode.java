package com.acme.shove.config;

/** When an inbound order delivery is acknowledged to the broker. */
public enum AckMode {
  /**
   * The broker considers a delivery consumed as soon as it is sent. An order in flight when the
   * worker dies is lost (at-most-once).
   */
  AUTO,

  /**
   * Deliveries are acknowledged only once the result message has been published, or immediately
   * when the order cannot be decoded. Unacknowledged orders are redelivered (at-least-once).
   */
  AFTER_PUBLISH;

  public boolean isBrokerAcknowledged() {
    return this == AUTO;
  }
}
