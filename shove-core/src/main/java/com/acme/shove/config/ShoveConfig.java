package com.acme.shove.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Worker settings: inbound queue, project-path table and execution policy. Pure POJO - no framework
 * dependencies. Built once at startup and handed to the components that need it.
 */
public class ShoveConfig {

  private String queueName = "shove";
  private Map<String, String> projects = new LinkedHashMap<>();
  private AckMode ackMode = AckMode.AFTER_PUBLISH;
  private Duration executionTimeout = Duration.ZERO; // Wait forever by default
  private String shell = "/bin/sh";

  public String getQueueName() {
    return queueName;
  }

  public void setQueueName(String queueName) {
    this.queueName = queueName;
  }

  public Map<String, String> getProjects() {
    return Collections.unmodifiableMap(projects);
  }

  public void setProjects(Map<String, String> projects) {
    this.projects = projects == null ? new LinkedHashMap<>() : new LinkedHashMap<>(projects);
  }

  /** Registers (or replaces) the filesystem root of a project. */
  public ShoveConfig addProject(String projectId, String path) {
    projects.put(projectId, path);
    return this;
  }

  /** Filesystem root of the given project, if the project is known. */
  public Optional<Path> findProjectPath(String projectId) {
    String path = projects.get(projectId);
    if (path == null || path.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(Path.of(path));
  }

  public AckMode getAckMode() {
    return ackMode;
  }

  public void setAckMode(AckMode ackMode) {
    this.ackMode = ackMode;
  }

  public Duration getExecutionTimeout() {
    return executionTimeout;
  }

  public void setExecutionTimeout(Duration executionTimeout) {
    this.executionTimeout = executionTimeout == null ? Duration.ZERO : executionTimeout;
  }

  public boolean isExecutionBounded() {
    return !executionTimeout.isZero() && !executionTimeout.isNegative();
  }

  public String getShell() {
    return shell;
  }

  public void setShell(String shell) {
    this.shell = shell;
  }
}
