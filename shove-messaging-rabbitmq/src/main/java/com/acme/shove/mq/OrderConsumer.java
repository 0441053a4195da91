package com.acme.shove.mq;

import com.acme.shove.config.AckMode;
import com.acme.shove.order.OrderHandler;
import com.acme.shove.spi.ResultPublisher;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;
import java.io.IOException;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Consumer of the inbound order queue. Deliveries on one channel are dispatched one after the
 * other, so the worker never runs two orders at once.
 */
public class OrderConsumer extends DefaultConsumer {
    private static final Logger LOG = LoggerFactory.getLogger(OrderConsumer.class);

    private final OrderHandler handler;
    private final ResultPublisher publisher;
    private final AckMode ackMode;
    private final Runnable onCancelled;
    private final ReentrantLock inFlight = new ReentrantLock();

    public OrderConsumer(
            Channel channel,
            OrderHandler handler,
            ResultPublisher publisher,
            AckMode ackMode,
            Runnable onCancelled) {
        super(channel);
        this.handler = handler;
        this.publisher = publisher;
        this.ackMode = ackMode;
        this.onCancelled = onCancelled;
    }

    @Override
    public void handleDelivery(
            String consumerTag, Envelope envelope, AMQP.BasicProperties properties, byte[] body)
            throws IOException {
        inFlight.lock();
        try {
            LOG.debug("Received delivery {} (redelivered={})", envelope.getDeliveryTag(), envelope.isRedeliver());
            try {
                handler.handle(body, publisher);
            } catch (RuntimeException e) {
                // Left unacknowledged; the broker hands it to another worker once this channel closes.
                LOG.error("Failed to handle delivery {}", envelope.getDeliveryTag(), e);
                throw e;
            }
            if (!ackMode.isBrokerAcknowledged()) {
                getChannel().basicAck(envelope.getDeliveryTag(), false);
            }
        } finally {
            inFlight.unlock();
        }
    }

    @Override
    public void handleCancel(String consumerTag) {
        LOG.warn("Consumer {} was cancelled by the broker", consumerTag);
        onCancelled.run();
    }

    /** Blocks until the order currently being handled, if any, is finished. */
    void awaitIdle() {
        inFlight.lock();
        inFlight.unlock();
    }
}
