package com.listinglab.scraper.model;

/**
 * Output of the field mapper: the listing row plus the child payloads that are
 * written once the listing id is known.
 */
public record MappedListing(CanonicalListing listing, ListingChildren children) {
}
