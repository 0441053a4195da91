package com.acme.shove;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.Consumer;
import io.micronaut.context.annotation.Factory;
import io.micronaut.context.annotation.Replaces;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import java.io.IOException;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Test configuration that replaces the RabbitMQ connection factory with Mockito mocks, so the
 * worker can start and stand down without a broker. Enabled with {@code shove.test.stub-broker}.
 */
@Factory
@Requires(property = "shove.test.stub-broker", value = "true")
public class StubBrokerFactory {

    private static final Logger LOG = LoggerFactory.getLogger(StubBrokerFactory.class);

    static final String CONSUMER_TAG = "ctag-1";

    private final Connection connection = mock(Connection.class);
    private final Channel channel = mock(Channel.class);

    @Singleton
    @Replaces(ConnectionFactory.class)
    public ConnectionFactory connectionFactory() {
        ConnectionFactory factory = mock(ConnectionFactory.class);
        try {
            when(factory.newConnection(anyString())).thenReturn(connection);
            when(connection.createChannel()).thenReturn(channel);
            when(connection.isOpen()).thenReturn(true);
            when(channel.isOpen()).thenReturn(true);
            when(channel.basicConsume(anyString(), anyBoolean(), any(Consumer.class))).thenReturn(CONSUMER_TAG);
            doAnswer(inv -> {
                LOG.info("Connection closed: {} {}", inv.getArgument(0), inv.getArgument(1));
                return null;
            }).when(connection).close(anyInt(), anyString());
        } catch (IOException | TimeoutException e) {
            throw new IllegalStateException("Failed to stub broker", e);
        }
        LOG.info("Using stub broker");
        return factory;
    }

    Connection connection() {
        return connection;
    }

    Channel channel() {
        return channel;
    }
}
