package com.listinglab.scraper.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Kind of search the provider runs for a location.
 */
public enum ListingType {
    FOR_SALE("for_sale"),
    FOR_RENT("for_rent"),
    SOLD("sold"),
    PENDING("pending");

    private final String wireValue;

    ListingType(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    public static Optional<ListingType> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalised = value.trim().toLowerCase();
        return Arrays.stream(values())
                .filter(type -> type.wireValue.equals(normalised))
                .findFirst();
    }
}
