package com.acme.shove.config;

import com.acme.shove.mq.RabbitConfig;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.context.event.StartupEvent;
import jakarta.inject.Singleton;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs effective configuration on application startup for visibility and troubleshooting.
 * Disabled in test environment.
 */
@Singleton
@Requires(notEnv = "test")
public class ConfigurationLogger implements ApplicationEventListener<StartupEvent> {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigurationLogger.class);

    private final ShoveConfig shoveConfig;
    private final RabbitConfig rabbitConfig;

    public ConfigurationLogger(ShoveConfig shoveConfig, RabbitConfig rabbitConfig) {
        this.shoveConfig = shoveConfig;
        this.rabbitConfig = rabbitConfig;
    }

    @Override
    public void onApplicationEvent(StartupEvent event) {
        LOG.info("═══════════════════════════════════════════════════════════════════════════════");
        LOG.info("                         EFFECTIVE CONFIGURATION                                ");
        LOG.info("═══════════════════════════════════════════════════════════════════════════════");

        LOG.info("━━━ Broker Configuration ━━━");
        LOG.info("  Broker:             {} (RabbitMQ address, password not shown)", rabbitConfig.describe());
        LOG.info("  Connect Timeout:    {}", rabbitConfig.getConnectionTimeout());
        LOG.info("  Order Queue:        {} (durable inbound queue)", shoveConfig.getQueueName());
        LOG.info("  Ack Mode:           {} ({})", shoveConfig.getAckMode(), describe(shoveConfig.getAckMode()));

        LOG.info("━━━ Execution Configuration ━━━");
        LOG.info("  Shell:              {}", shoveConfig.getShell());
        LOG.info(
                "  Timeout:            {}",
                shoveConfig.isExecutionBounded() ? shoveConfig.getExecutionTimeout() : "none (wait until exit)");

        LOG.info("━━━ Projects ━━━");
        Map<String, String> projects = shoveConfig.getProjects();
        if (projects.isEmpty()) {
            LOG.warn("  No projects configured - every order will be answered with return code 1");
        }
        projects.forEach((id, path) -> LOG.info("  {} -> {}", id, path));
        LOG.info("═══════════════════════════════════════════════════════════════════════════════");
    }

    static String describe(AckMode mode) {
        return mode.isBrokerAcknowledged()
                ? "at-most-once, orders in flight are lost on crash"
                : "at-least-once, acknowledged after the result is published";
    }
}
