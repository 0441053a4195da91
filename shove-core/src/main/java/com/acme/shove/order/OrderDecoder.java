package com.acme.shove.order;

import com.acme.shove.core.Jsons;
import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decodes inbound message bodies into {@link Order}s. Bodies that are not a JSON object carrying the
 * four required non-empty string fields are logged and rejected; nothing is thrown.
 */
public class OrderDecoder {
  private static final Logger log = LoggerFactory.getLogger(OrderDecoder.class);

  static final String PROJECT = "project";
  static final String COMMAND = "command";
  static final String LOG_KEY = "log_key";
  static final String LOG_QUEUE = "log_queue";

  public Optional<Order> decode(byte[] body) {
    JsonNode node;
    try {
      node = Jsons.readTree(body == null ? new byte[0] : body);
    } catch (IOException e) {
      log.error("Could not parse order: `{}` ({})", text(body), e.getMessage());
      return Optional.empty();
    }

    if (node == null || !node.isObject()) {
      log.error("Could not parse order: `{}` (not a JSON object)", text(body));
      return Optional.empty();
    }

    String project = field(node, PROJECT);
    String command = field(node, COMMAND);
    String logKey = field(node, LOG_KEY);
    String logQueue = field(node, LOG_QUEUE);
    if (project == null || command == null || logKey == null || logQueue == null) {
      log.error("Could not parse order: `{}`", text(body));
      return Optional.empty();
    }
    return Optional.of(new Order(project, command, logKey, logQueue));
  }

  private static String field(JsonNode node, String name) {
    JsonNode value = node.get(name);
    if (value == null || !value.isTextual() || value.asText().isEmpty()) {
      return null;
    }
    return value.asText();
  }

  private static String text(byte[] body) {
    return body == null ? "" : new String(body, StandardCharsets.UTF_8);
  }
}
