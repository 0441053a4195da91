package com.acme.shove.config;

import io.micronaut.context.annotation.ConfigurationProperties;
import io.micronaut.core.convert.format.MapFormat;
import io.micronaut.core.naming.conventions.StringConvention;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Binds the {@code shove.*} properties. Copied into a {@link ShoveConfig} so the core module stays
 * free of framework annotations.
 */
@ConfigurationProperties("shove")
public class ShoveProperties {

  private String queueName = "shove";
  private Map<String, String> projects = new LinkedHashMap<>();
  private AckMode ackMode = AckMode.AFTER_PUBLISH;
  private Duration executionTimeout = Duration.ZERO;
  private String shell = "/bin/sh";

  public String getQueueName() {
    return queueName;
  }

  public void setQueueName(String queueName) {
    this.queueName = queueName;
  }

  public Map<String, String> getProjects() {
    return projects;
  }

  /** Project ids are kept as written; orders name them verbatim. */
  public void setProjects(
      @MapFormat(
              keyFormat = StringConvention.RAW,
              transformation = MapFormat.MapTransformation.FLAT)
          Map<String, String> projects) {
    this.projects = projects == null ? new LinkedHashMap<>() : new LinkedHashMap<>(projects);
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
    this.executionTimeout = executionTimeout;
  }

  public String getShell() {
    return shell;
  }

  public void setShell(String shell) {
    this.shell = shell;
  }

  ShoveConfig toShoveConfig() {
    ShoveConfig config = new ShoveConfig();
    config.setQueueName(queueName);
    config.setProjects(projects);
    config.setAckMode(ackMode);
    config.setExecutionTimeout(executionTimeout);
    config.setShell(shell);
    return config;
  }
}
