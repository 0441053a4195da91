package com.acme.shove.manifest;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Parsed command manifest of one project: command name to shell invocation. Invocations are kept
 * verbatim, placeholders such as {@code %(PORT)d} included.
 */
public final class Procfile {

  private final Map<String, String> commands;

  public Procfile(Map<String, String> commands) {
    this.commands = Collections.unmodifiableMap(new LinkedHashMap<>(commands));
  }

  public Optional<String> command(String name) {
    return Optional.ofNullable(commands.get(name));
  }

  Set<String> names() {
    return commands.keySet();
  }

  public Map<String, String> commands() {
    return commands;
  }

  boolean isEmpty() {
    return commands.isEmpty();
  }

  @Override
  public String toString() {
    return "Procfile" + commands.keySet();
  }
}
