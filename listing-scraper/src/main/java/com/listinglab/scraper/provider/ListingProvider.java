package com.listinglab.scraper.provider;

import com.listinglab.scraper.model.ListingType;
import com.listinglab.scraper.model.RawListing;

import java.util.List;
import java.util.Map;

/**
 * Source of raw listings for a location search.
 */
public interface ListingProvider {

    /**
     * @param location    free-text location (address, city, zip)
     * @param listingType kind of search
     * @param limit       maximum results, or null for the provider default
     * @param params      extra provider parameters, passed through as-is
     * @return results in provider order, never null
     */
    List<RawListing> fetch(String location, ListingType listingType, Integer limit, Map<String, Object> params);
}
