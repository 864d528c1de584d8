package com.listinglab.scraper.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PropertyType {
    SINGLE_FAMILY("single_family"),
    MULTI_FAMILY("multi_family"),
    CONDOS("condos"),
    CONDO_TOWNHOME("condo_townhome"),
    TOWNHOMES("townhomes"),
    DUPLEX_TRIPLEX("duplex_triplex"),
    FARM("farm"),
    LAND("land"),
    MOBILE("mobile");

    private final String storeValue;

    PropertyType(String storeValue) {
        this.storeValue = storeValue;
    }

    @JsonValue
    public String storeValue() {
        return storeValue;
    }
}
