package com.listinglab.scraper.broker;

import com.listinglab.scraper.config.ListingScraperProperties;
import io.github.resilience4j.core.IntervalFunction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.AmqpAdmin;
import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.TopicExchange;
import org.springframework.amqp.rabbit.connection.Connection;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Opens the broker connection and declares the scrape topology: a durable
 * topic exchange, a durable queue and the binding between them.
 *
 * Connection failures are retried with exponential backoff (2s, 4s, 8s, ...
 * with the default settings) up to a fixed number of attempts. The connection
 * itself belongs to the connection factory and is closed with the context.
 */
@Component
@Slf4j
public class BrokerConnector {

    private final ConnectionFactory connectionFactory;
    private final AmqpAdmin amqpAdmin;
    private final ListingScraperProperties.Broker properties;
    private final BackoffSleeper sleeper;
    private final IntervalFunction backoff;

    @Autowired
    public BrokerConnector(ConnectionFactory connectionFactory, AmqpAdmin amqpAdmin, ListingScraperProperties properties) {
        this(connectionFactory, amqpAdmin, properties, BackoffSleeper.threadSleep());
    }

    BrokerConnector(ConnectionFactory connectionFactory, AmqpAdmin amqpAdmin,
                    ListingScraperProperties properties, BackoffSleeper sleeper) {
        this.connectionFactory = connectionFactory;
        this.amqpAdmin = amqpAdmin;
        this.properties = properties.getBroker();
        this.sleeper = sleeper;
        this.backoff = IntervalFunction.ofExponentialBackoff(this.properties.getInitialBackoff(), 2.0);
    }

    public void connect() {
        int maxAttempts = properties.getMaxConnectAttempts();
        for (int attempt = 1; ; attempt++) {
            try {
                log.info("Connecting to broker (attempt {}/{})", attempt, maxAttempts);
                Connection connection = connectionFactory.createConnection();
                if (!connection.isOpen()) {
                    throw new IllegalStateException("Broker connection is not open");
                }
                declareTopology();
                log.info("Connected to broker, consuming from queue '{}'", properties.getQueue());
                return;

            } catch (AmqpException | IllegalStateException e) {
                if (attempt >= maxAttempts) {
                    throw new BrokerConnectionException(
                            "Could not connect to broker after " + maxAttempts + " attempts", e);
                }
                Duration wait = Duration.ofMillis(backoff.apply(attempt));
                log.warn("Broker connection failed: {}. Retrying in {}s", e.getMessage(), wait.toSeconds());
                pause(wait, e);
            }
        }
    }

    private void declareTopology() {
        TopicExchange exchange = new TopicExchange(properties.getExchange(), true, false);
        Queue queue = new Queue(properties.getQueue(), true);
        Binding binding = BindingBuilder.bind(queue).to(exchange).with(properties.getRoutingKey());

        amqpAdmin.declareExchange(exchange);
        amqpAdmin.declareQueue(queue);
        amqpAdmin.declareBinding(binding);
        log.debug("Declared exchange '{}' -> queue '{}' on '{}'",
                exchange.getName(), queue.getName(), properties.getRoutingKey());
    }

    private void pause(Duration wait, Exception cause) {
        try {
            sleeper.sleep(wait);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new BrokerConnectionException("Interrupted while waiting to reconnect to broker", cause);
        }
    }
}
