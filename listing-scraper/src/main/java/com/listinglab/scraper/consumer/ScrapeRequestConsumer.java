package com.listinglab.scraper.consumer;

import com.listinglab.scraper.model.ScrapeRequest;
import com.listinglab.scraper.service.ListingIngestionService;
import com.rabbitmq.client.Channel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;

/**
 * Consumes scrape requests one at a time with manual acknowledgement.
 *
 * Unusable messages are acknowledged and dropped. A message whose processing
 * fails is rejected without requeue, so a poison message cannot loop.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ScrapeRequestConsumer {

    public static final String LISTENER_ID = "listingScrapeConsumer";

    private final ScrapeRequestReader reader;
    private final ListingIngestionService ingestionService;
    private final ConsumerStats stats;

    @RabbitListener(id = LISTENER_ID,
            queues = "${listing-scraper.broker.queue}",
            containerFactory = "scrapeListenerContainerFactory")
    public void onMessage(Message message, Channel channel) throws IOException {
        long deliveryTag = message.getMessageProperties().getDeliveryTag();
        log.info("Received message {}", deliveryTag);

        ScrapeRequest request;
        try {
            request = reader.read(message.getBody());
        } catch (InvalidScrapeRequestException e) {
            log.error("Dropping message {}: {}", deliveryTag, e.getMessage());
            drop(channel, deliveryTag);
            return;
        } catch (RuntimeException e) {
            log.error("Dropping unreadable message {}: {}", deliveryTag, e.getMessage(), e);
            drop(channel, deliveryTag);
            return;
        }

        boolean processed;
        try {
            List<Long> listingIds = ingestionService.ingest(request);
            log.info("Scrape for '{}' wrote listings {}", request.getLocation(), listingIds);
            processed = true;
        } catch (RuntimeException e) {
            log.error("Error processing scrape for '{}': {}", request.getLocation(), e.getMessage(), e);
            processed = false;
        }

        if (processed) {
            channel.basicAck(deliveryTag, false);
            stats.recordAcknowledged();
        } else {
            channel.basicReject(deliveryTag, false);
            stats.recordRejected();
        }
    }

    private void drop(Channel channel, long deliveryTag) throws IOException {
        channel.basicAck(deliveryTag, false);
        stats.recordDropped();
    }
}
