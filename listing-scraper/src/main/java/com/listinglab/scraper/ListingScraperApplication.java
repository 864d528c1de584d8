package com.listinglab.scraper;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties
public class ListingScraperApplication {

    public static void main(String[] args) {
        SpringApplication.run(ListingScraperApplication.class, args);
    }
}
