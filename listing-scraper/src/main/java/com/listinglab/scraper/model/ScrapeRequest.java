package com.listinglab.scraper.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * One scrape request as read off the queue.
 */
@Value
@Builder
public class ScrapeRequest {

    String location;

    @Builder.Default
    ListingType listingType = ListingType.FOR_SALE;

    /** Target listing for direct-update mode; null means match or create. */
    Long recordId;

    Integer limit;

    /** Informational only, never forwarded to the provider. */
    String sourceUrl;

    /** Anything else in the message, passed through to the provider untouched. */
    @Builder.Default
    Map<String, Object> extraParameters = Map.of();

    public boolean isDirectUpdate() {
        return recordId != null;
    }
}
