package com.listinglab.scraper.reconcile;

import com.listinglab.scraper.model.CanonicalListing;

import java.util.Optional;

/**
 * One step of the matching cascade: finds an existing listing by a single key.
 */
@FunctionalInterface
public interface ListingMatcher {

    Optional<Long> match(CanonicalListing listing);
}
