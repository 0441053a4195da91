package com.acme.shove.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;

public final class Jsons {
  private static final ObjectMapper M = new ObjectMapper();

  private Jsons() {}

  public static String toJson(Object o) {
    try {
      return M.writeValueAsString(o);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize " + o.getClass().getSimpleName(), e);
    }
  }

  public static byte[] toJsonBytes(Object o) {
    try {
      return M.writeValueAsBytes(o);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize " + o.getClass().getSimpleName(), e);
    }
  }

  /** Parses a JSON document. An empty body yields a missing node rather than an error. */
  public static JsonNode readTree(byte[] body) throws IOException {
    return M.readTree(body);
  }
}
