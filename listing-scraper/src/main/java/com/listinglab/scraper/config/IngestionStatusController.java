package com.listinglab.scraper.config;

import com.listinglab.scraper.consumer.ConsumerStats;
import com.listinglab.scraper.consumer.ScrapeRequestConsumer;
import lombok.RequiredArgsConstructor;
import org.springframework.amqp.rabbit.listener.MessageListenerContainer;
import org.springframework.amqp.rabbit.listener.RabbitListenerEndpointRegistry;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequiredArgsConstructor
public class IngestionStatusController {

    private final ListingScraperProperties properties;
    private final RabbitListenerEndpointRegistry listenerRegistry;
    private final ConsumerStats stats;

    @GetMapping("/scrape/status")
    public ResponseEntity<Map<String, Object>> status() {
        MessageListenerContainer container = listenerRegistry.getListenerContainer(ScrapeRequestConsumer.LISTENER_ID);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("service", "listing-scraper");
        body.put("queue", properties.getBroker().getQueue());
        body.put("consuming", container != null && container.isRunning());
        body.put("messages", stats.snapshot());
        return ResponseEntity.ok(body);
    }
}
