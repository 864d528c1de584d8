package com.listinglab.scraper.bootstrap;

import com.listinglab.scraper.broker.BrokerConnector;
import com.listinglab.scraper.config.ListingScraperProperties;
import com.listinglab.scraper.consumer.ScrapeRequestConsumer;
import com.listinglab.scraper.store.StoreClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.listener.MessageListenerContainer;
import org.springframework.amqp.rabbit.listener.RabbitListenerEndpointRegistry;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Startup sequence: check the store credentials, confirm the store answers,
 * set up the broker, then start consuming.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ScraperBootstrap implements ApplicationRunner {

    private final ListingScraperProperties properties;
    private final StoreClient storeClient;
    private final BrokerConnector brokerConnector;
    private final RabbitListenerEndpointRegistry listenerRegistry;

    @Override
    public void run(ApplicationArguments args) {
        if (!StringUtils.hasText(properties.getStore().getApiKey())) {
            log.error("ODOO_API_KEY is not set. Create an API key for the integration user "
                    + "(Preferences > Account Security > New API Key) and set it in the environment.");
            throw new IllegalStateException("Store API key is not configured");
        }

        storeClient.verifyConnection();
        brokerConnector.connect();

        MessageListenerContainer container = listenerRegistry.getListenerContainer(ScrapeRequestConsumer.LISTENER_ID);
        if (container == null) {
            throw new IllegalStateException("No listener container registered as " + ScrapeRequestConsumer.LISTENER_ID);
        }
        container.start();
        log.info("Listing scraper started, waiting for messages on '{}'", properties.getBroker().getQueue());
    }
}
