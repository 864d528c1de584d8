package com.listinglab.scraper.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "listing-scraper")
@Data
public class ListingScraperProperties {

    private Broker broker = new Broker();
    private Store store = new Store();
    private Provider provider = new Provider();

    @Data
    public static class Broker {
        private String exchange = "property_exchange";
        private String queue = "property_scrape_queue";
        private String routingKey = "property.scrape";
        private int maxConnectAttempts = 10;
        /** Wait after the first failed attempt; doubles on each further failure. */
        private Duration initialBackoff = Duration.ofSeconds(2);
    }

    @Data
    public static class Store {
        private String url = "http://localhost:8069";
        /** Sent as the database header for multi-database stores. Blank means omit. */
        private String database;
        private String apiKey;
        private Duration connectTimeout = Duration.ofSeconds(30);
        private Duration readTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Provider {
        private String url = "http://localhost:8000";
        private Duration connectTimeout = Duration.ofSeconds(30);
        private Duration readTimeout = Duration.ofSeconds(120);
    }
}
