package com.acme.shove.mq;

import io.micronaut.context.annotation.ConfigurationProperties;
import java.time.Duration;

/** Broker connection settings, bound from the {@code rabbitmq.*} properties. */
@ConfigurationProperties("rabbitmq")
public class RabbitConfig {

    private String host = "localhost";
    private int port = 5672;
    private String virtualHost = "/";
    private String username = "guest";
    private String password = "guest";
    private Duration connectionTimeout = Duration.ofSeconds(10);

    public String getHost() {
        return host;
    }

    public void setHost(String host) {
        this.host = host;
    }

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    public String getVirtualHost() {
        return virtualHost;
    }

    public void setVirtualHost(String virtualHost) {
        this.virtualHost = virtualHost;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }

    public Duration getConnectionTimeout() {
        return connectionTimeout;
    }

    public void setConnectionTimeout(Duration connectionTimeout) {
        this.connectionTimeout = connectionTimeout;
    }

    /** Broker address for logs, e.g. {@code amqp://guest@localhost:5672/}. Never includes the password. */
    public String describe() {
        String vhost = virtualHost.startsWith("/") ? virtualHost : "/" + virtualHost;
        return "amqp://" + username + "@" + host + ":" + port + vhost;
    }
}
