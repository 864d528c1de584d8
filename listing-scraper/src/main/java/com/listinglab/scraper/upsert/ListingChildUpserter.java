package com.listinglab.scraper.upsert;

import com.listinglab.scraper.model.ListingChildren;

/**
 * Writes one kind of listing-owned data once the listing row exists.
 * Each implementation is run in isolation: a failure in one must not stop the others.
 */
public interface ListingChildUpserter {

    /** Short label used in logs, e.g. "photos". */
    String name();

    void upsert(long listingId, ListingChildren children);
}
