package com.listinglab.scraper.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum MarketStatus {
    ACTIVE("active"),
    PENDING("pending"),
    CONTINGENT("contingent"),
    SOLD("sold"),
    OFF_MARKET("off_market");

    private final String storeValue;

    MarketStatus(String storeValue) {
        this.storeValue = storeValue;
    }

    @JsonValue
    public String storeValue() {
        return storeValue;
    }
}
