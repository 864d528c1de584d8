package com.listinglab.scraper.service;

import com.listinglab.scraper.mapping.ListingFieldMapper;
import com.listinglab.scraper.model.CanonicalListing;
import com.listinglab.scraper.model.MappedListing;
import com.listinglab.scraper.model.RawListing;
import com.listinglab.scraper.model.ScrapeRequest;
import com.listinglab.scraper.provider.ListingProvider;
import com.listinglab.scraper.reconcile.ListingReconciler;
import com.listinglab.scraper.store.StoreClient;
import com.listinglab.scraper.store.StoreException;
import com.listinglab.scraper.store.StoreModels;
import com.listinglab.scraper.upsert.ListingChildUpserter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs one scrape request end to end: fetch, map, reconcile, upsert the
 * listing, then its sub-collections.
 *
 * A failure fetching or writing the listing itself propagates to the caller.
 * Sub-collection failures are logged per upserter and do not undo the listing.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ListingIngestionService {

    private final ListingProvider provider;
    private final ListingFieldMapper mapper;
    private final ListingReconciler reconciler;
    private final StoreClient storeClient;
    private final List<ListingChildUpserter> upserters;

    /**
     * @return ids of the listings written, in provider order
     */
    public List<Long> ingest(ScrapeRequest request) {
        List<RawListing> results = provider.fetch(
                request.getLocation(), request.getListingType(), request.getLimit(), request.getExtraParameters());

        if (results.isEmpty()) {
            log.info("No listings found for '{}'", request.getLocation());
            return List.of();
        }
        if (request.isDirectUpdate() && results.size() > 1) {
            log.error("Expected 1 result for direct update of record {} but got {}; processing the first only",
                    request.getRecordId(), results.size());
            results = results.subList(0, 1);
        }

        List<Long> listingIds = new ArrayList<>(results.size());
        for (RawListing raw : results) {
            listingIds.add(upsertListing(raw, request.getRecordId()));
        }
        log.info("Processed {} listings for '{}'", listingIds.size(), request.getLocation());
        return listingIds;
    }

    public long upsertListing(RawListing raw, Long recordId) {
        MappedListing mapped = mapper.map(raw);
        CanonicalListing listing = mapped.listing();
        Map<String, Object> values = mapper.toStoreValues(listing);

        long listingId;
        Optional<Long> existing = reconciler.resolve(listing, recordId);
        if (existing.isPresent()) {
            listingId = existing.get();
            log.info("Updating existing listing ID: {}", listingId);
            if (!storeClient.write(StoreModels.LISTING, List.of(listingId), values)) {
                throw new StoreException("Store refused update of listing " + listingId);
            }
        } else {
            listingId = storeClient.create(StoreModels.LISTING, values);
            log.info("Created new listing ID: {}", listingId);
        }

        for (ListingChildUpserter upserter : upserters) {
            try {
                upserter.upsert(listingId, mapped.children());
            } catch (RuntimeException e) {
                log.error("Error processing {} for listing {}: {}", upserter.name(), listingId, e.getMessage(), e);
            }
        }
        return listingId;
    }
}
