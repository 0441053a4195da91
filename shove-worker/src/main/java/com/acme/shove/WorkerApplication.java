package com.acme.shove;

import com.acme.shove.mq.WorkerLoop;
import io.micronaut.context.ApplicationContext;
import io.micronaut.runtime.Micronaut;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Worker Application - Runs project commands ordered over RabbitMQ. Consumes orders one at a time
 * and publishes each result to the queue the order names. Run several instances against the same
 * queue to scale out.
 */
public class WorkerApplication {
    private static final Logger LOG = LoggerFactory.getLogger(WorkerApplication.class);

    /** Optional extra configuration file, layered over application.yml. */
    static final String SETTINGS_FILE_ENV = "SHOVE_SETTINGS_FILE";
    static final String CONFIG_FILES_PROPERTY = "micronaut.config.files";

    public static void main(String[] args) throws InterruptedException {
        useSettingsFile(System.getenv(SETTINGS_FILE_ENV));

        ApplicationContext context = Micronaut.run(WorkerApplication.class, args);
        closeOnShutdown(context);
        Optional<WorkerLoop> loop = context.findBean(WorkerLoop.class);
        if (loop.isEmpty()) {
            LOG.warn("Order consumer disabled (shove.consumer.enabled=false), nothing to do");
            context.close();
            return;
        }
        boolean clean = loop.get().awaitTermination();
        if (!clean) {
            LOG.error("Worker lost its order channel, exiting");
            context.close();
            System.exit(1);
        }
    }

    /**
     * Closes the context when the JVM is asked to exit (SIGINT/SIGTERM), so the worker loop stands
     * down gracefully. Micronaut only does this itself when an embedded server is running.
     */
    static Thread closeOnShutdown(ApplicationContext context) {
        Thread hook = new Thread(() -> {
            if (context.isRunning()) {
                LOG.info("Shutdown requested");
                context.close();
            }
        }, "shove-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        return hook;
    }

    static void useSettingsFile(String settingsFile) {
        if (settingsFile == null || settingsFile.isBlank()) {
            return;
        }
        String existing = System.getProperty(CONFIG_FILES_PROPERTY);
        String files = existing == null || existing.isBlank() ? settingsFile : existing + "," + settingsFile;
        System.setProperty(CONFIG_FILES_PROPERTY, files);
        LOG.info("Loading settings from {}", settingsFile);
    }
}
