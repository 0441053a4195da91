package com.acme.shove.mq;

import com.acme.shove.config.ShoveConfig;
import com.acme.shove.order.OrderHandler;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.ShutdownSignalException;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.context.event.StartupEvent;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Singleton;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the broker connection and the single channel orders are consumed from. Starts consuming
 * when the application context starts and stands down when it is closed, letting the order in
 * flight finish first.
 */
@Singleton
@Requires(property = "shove.consumer.enabled", notEquals = "false")
public class WorkerLoop implements ApplicationEventListener<StartupEvent> {
    private static final Logger LOG = LoggerFactory.getLogger(WorkerLoop.class);
    static final String FAREWELL = "Shove standing down, sir!";

    private final ConnectionFactory connectionFactory;
    private final ShoveConfig config;
    private final OrderHandler handler;

    private final AtomicBoolean stopping = new AtomicBoolean(false);
    private final AtomicBoolean failed = new AtomicBoolean(false);
    private final CountDownLatch terminated = new CountDownLatch(1);

    private Connection connection;
    private Channel channel;
    private OrderConsumer consumer;
    private String consumerTag;

    public WorkerLoop(ConnectionFactory connectionFactory, ShoveConfig config, OrderHandler handler) {
        this.connectionFactory = connectionFactory;
        this.config = config;
        this.handler = handler;
    }

    @Override
    public void onApplicationEvent(StartupEvent event) {
        start();
    }

    public synchronized void start() {
        if (connection != null) {
            return;
        }
        String queue = config.getQueueName();
        try {
            connection = connectionFactory.newConnection("shove-worker");
            channel = connection.createChannel();
            channel.addShutdownListener(this::onChannelShutdown);
            channel.queueDeclare(queue, true, false, false, null);

            boolean autoAck = config.getAckMode().isBrokerAcknowledged();
            if (!autoAck) {
                channel.basicQos(1);
            }
            consumer =
                    new OrderConsumer(
                            channel,
                            handler,
                            new RabbitResultPublisher(channel),
                            config.getAckMode(),
                            () -> terminate(true));
            consumerTag = channel.basicConsume(queue, autoAck, consumer);
        } catch (IOException | TimeoutException e) {
            abortConnection();
            throw new IllegalStateException("Failed to start consuming from queue: " + queue, e);
        }
        LOG.info("Consuming from {} (ackMode={})", queue, config.getAckMode());
        LOG.info("Awaiting orders, sir!");
    }

    /**
     * Blocks until the worker stops, either through {@link #stop()} or because the broker closed the
     * channel underneath it.
     *
     * @return {@code true} when the worker stood down cleanly
     */
    public boolean awaitTermination() throws InterruptedException {
        terminated.await();
        return !failed.get();
    }

    @PreDestroy
    public synchronized void stop() {
        if (connection == null || !stopping.compareAndSet(false, true)) {
            return;
        }
        LOG.info("Standing down and returning to base, sir!");
        try {
            if (channel.isOpen() && consumerTag != null) {
                channel.basicCancel(consumerTag);
            }
        } catch (IOException | ShutdownSignalException e) {
            LOG.warn("Failed to cancel consumer {}", consumerTag, e);
        }

        consumer.awaitIdle();

        try {
            if (connection.isOpen()) {
                connection.close(AMQP.REPLY_SUCCESS, FAREWELL);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to close broker connection", e);
        } finally {
            terminate(false);
        }
    }

    boolean isRunning() {
        return connection != null && connection.isOpen() && !stopping.get();
    }

    private void onChannelShutdown(ShutdownSignalException cause) {
        if (stopping.get()) {
            return;
        }
        LOG.error("Order channel closed unexpectedly: {}", cause.getMessage());
        terminate(true);
    }

    private void terminate(boolean failure) {
        if (failure) {
            failed.set(true);
        }
        terminated.countDown();
    }

    private void abortConnection() {
        if (connection == null) {
            return;
        }
        try {
            connection.abort();
        } finally {
            connection = null;
        }
    }
}
