package com.acme.shove.mq;

import com.rabbitmq.client.ConnectionFactory;
import io.micronaut.context.annotation.Factory;
import jakarta.inject.Singleton;

@Factory
public class RabbitConnectionFactoryProvider {

    @Singleton
    public ConnectionFactory rabbitConnectionFactory(RabbitConfig config) {
        var cf = new ConnectionFactory();
        cf.setHost(config.getHost());
        cf.setPort(config.getPort());
        cf.setVirtualHost(config.getVirtualHost());
        cf.setUsername(config.getUsername());
        cf.setPassword(config.getPassword());
        cf.setConnectionTimeout((int) config.getConnectionTimeout().toMillis());

        // A lost broker connection is fatal for the worker; another instance picks up the queue.
        cf.setAutomaticRecoveryEnabled(false);
        cf.setTopologyRecoveryEnabled(false);
        return cf;
    }
}
