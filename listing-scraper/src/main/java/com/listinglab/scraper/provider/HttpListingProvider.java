package com.listinglab.scraper.provider;

import com.listinglab.scraper.config.ListingScraperProperties;
import com.listinglab.scraper.model.ListingType;
import com.listinglab.scraper.model.RawListing;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Thin client over the scraping provider's HTTP endpoint.
 *
 * Scrapes can take minutes, hence the long read timeout on the provider
 * RestTemplate. No retry: a failure here fails the message.
 */
@Service
@Slf4j
public class HttpListingProvider implements ListingProvider {

    private final RestTemplate restTemplate;
    private final ListingScraperProperties properties;

    public HttpListingProvider(@Qualifier("providerRestTemplate") RestTemplate restTemplate,
                               ListingScraperProperties properties) {
        this.restTemplate = restTemplate;
        this.properties = properties;
    }

    @Override
    public List<RawListing> fetch(String location, ListingType listingType, Integer limit, Map<String, Object> params) {
        String url = properties.getProvider().getUrl() + "/scrape";

        Map<String, Object> body = new LinkedHashMap<>(params);
        body.put("location", location);
        body.put("listing_type", listingType.wireValue());
        if (limit != null) {
            body.put("limit", limit);
        }

        log.info("Scraping {} listings for '{}' (limit={})", listingType.wireValue(), location, limit);
        try {
            RawListing[] response = restTemplate.postForObject(url, body, RawListing[].class);
            if (response == null) {
                return Collections.emptyList();
            }
            List<RawListing> listings = Arrays.stream(response)
                    .filter(Objects::nonNull)
                    .collect(Collectors.toList());
            if (listings.size() < response.length) {
                log.warn("Provider returned {} null entries for '{}', skipping them",
                        response.length - listings.size(), location);
            }
            log.info("Provider returned {} listings for '{}'", listings.size(), location);
            return listings;

        } catch (RuntimeException e) {
            log.error("Provider call failed for '{}': {}", location, e.getMessage());
            throw e;
        }
    }
}
