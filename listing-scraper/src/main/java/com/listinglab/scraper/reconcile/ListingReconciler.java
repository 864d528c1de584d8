package com.listinglab.scraper.reconcile;

import com.listinglab.scraper.model.CanonicalListing;
import com.listinglab.scraper.store.StoreClient;
import com.listinglab.scraper.store.StoreCommands;
import com.listinglab.scraper.store.StoreModels;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Decides which stored listing an incoming listing updates, if any.
 *
 * Keys are tried from most to least reliable: property id, MLS listing id (not
 * the board code, which many listings share), listing URL,
 * formatted address. The first key that finds a row wins. There is no locking,
 * two consumers racing on the same new listing can both miss and both create.
 */
@Service
@Slf4j
public class ListingReconciler {

    private final List<ListingMatcher> matchers;

    @Autowired
    public ListingReconciler(StoreClient storeClient) {
        this(List.of(
                byField(storeClient, "property_id", CanonicalListing::getPropertyId),
                byField(storeClient, "mls_id", CanonicalListing::getMlsId),
                byField(storeClient, "url", CanonicalListing::getUrl),
                byField(storeClient, "address", CanonicalListing::getAddress)
        ));
    }

    ListingReconciler(List<ListingMatcher> matchers) {
        this.matchers = List.copyOf(matchers);
    }

    /**
     * @param listing    mapped listing
     * @param explicitId target from a direct-update request; when set it is returned as-is
     * @return id of the listing to update, or empty to create a new one
     */
    public Optional<Long> resolve(CanonicalListing listing, Long explicitId) {
        if (explicitId != null) {
            log.info("Using provided record_id: {} for direct update", explicitId);
            return Optional.of(explicitId);
        }
        for (ListingMatcher matcher : matchers) {
            Optional<Long> match = matcher.match(listing);
            if (match.isPresent()) {
                return match;
            }
        }
        return Optional.empty();
    }

    static ListingMatcher byField(StoreClient storeClient, String field, Function<CanonicalListing, String> key) {
        return listing -> {
            String value = key.apply(listing);
            if (value == null || value.isBlank()) {
                return Optional.empty();
            }
            List<Long> ids = storeClient.search(StoreModels.LISTING, StoreCommands.where(field, value));
            if (ids.isEmpty()) {
                return Optional.empty();
            }
            if (ids.size() > 1) {
                log.warn("{} listings share {}={}, using {}", ids.size(), field, value, ids.get(0));
            }
            log.debug("Matched listing {} by {}", ids.get(0), field);
            return Optional.of(ids.get(0));
        };
    }
}
