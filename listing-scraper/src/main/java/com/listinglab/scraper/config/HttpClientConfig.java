package com.listinglab.scraper.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * One RestTemplate per outbound system so each keeps its own timeouts.
 */
@Configuration
public class HttpClientConfig {

    @Bean
    public RestTemplate storeRestTemplate(RestTemplateBuilder builder, ListingScraperProperties properties) {
        ListingScraperProperties.Store store = properties.getStore();
        return builder
                .setConnectTimeout(store.getConnectTimeout())
                .setReadTimeout(store.getReadTimeout())
                .build();
    }

    @Bean
    public RestTemplate providerRestTemplate(RestTemplateBuilder builder, ListingScraperProperties properties) {
        ListingScraperProperties.Provider provider = properties.getProvider();
        return builder
                .setConnectTimeout(provider.getConnectTimeout())
                .setReadTimeout(provider.getReadTimeout())
                .build();
    }
}
