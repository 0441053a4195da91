package com.acme.shove.order;

import com.acme.shove.core.Jsons;
import com.acme.shove.exec.ExecutionResult;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** Report of an order's outcome, published to the queue the order named. */
@JsonPropertyOrder({"version", "log_key", "return_code", "output"})
public record ResultMessage(
    @JsonProperty("version") String version,
    @JsonProperty("log_key") String logKey,
    @JsonProperty("return_code") int returnCode,
    @JsonProperty("output") String output) {

  /** Version of the result message format. */
  public static final String FORMAT_VERSION = "1.0";

  public static ResultMessage of(Order order, ExecutionResult result) {
    return new ResultMessage(FORMAT_VERSION, order.logKey(), result.returnCode(), result.output());
  }

  public byte[] toJsonBytes() {
    return Jsons.toJsonBytes(this);
  }

  String toJson() {
    return Jsons.toJson(this);
  }
}
