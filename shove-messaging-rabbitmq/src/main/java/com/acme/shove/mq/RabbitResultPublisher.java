package com.acme.shove.mq;

import com.acme.shove.core.ResultPublishException;
import com.acme.shove.spi.ResultPublisher;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Publishes result messages through the default exchange of the worker's channel. */
public class RabbitResultPublisher implements ResultPublisher {
    private static final Logger LOG = LoggerFactory.getLogger(RabbitResultPublisher.class);
    private static final String DEFAULT_EXCHANGE = "";

    static final AMQP.BasicProperties RESULT_PROPERTIES =
            new AMQP.BasicProperties.Builder()
                    .contentType("application/json")
                    .contentEncoding("UTF-8")
                    .deliveryMode(2)
                    .build();

    private final Channel channel;

    public RabbitResultPublisher(Channel channel) {
        this.channel = channel;
    }

    @Override
    public void declareQueue(String queue) {
        try {
            channel.queueDeclare(queue, true, false, false, null);
        } catch (IOException e) {
            throw new ResultPublishException("Failed to declare queue: " + queue, e);
        }
    }

    @Override
    public void publish(String queue, byte[] body) {
        try {
            channel.basicPublish(DEFAULT_EXCHANGE, queue, RESULT_PROPERTIES, body);
            LOG.debug("Published {} bytes to {}", body.length, queue);
        } catch (IOException e) {
            throw new ResultPublishException("Failed to publish to queue: " + queue, e);
        }
    }
}
