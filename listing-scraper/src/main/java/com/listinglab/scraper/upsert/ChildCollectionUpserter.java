package com.listinglab.scraper.upsert;

import com.listinglab.scraper.model.ListingChildren;
import com.listinglab.scraper.store.StoreClient;
import com.listinglab.scraper.store.StoreCommands;
import com.listinglab.scraper.store.StoreModels;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Shared create-or-update pass for rows owned by a listing.
 *
 * Reads the listing's existing rows (id plus natural-key fields only), then for
 * each incoming item either writes to the row with the same natural key or
 * creates a new one. Created rows join the lookup, so a repeated key later in
 * the same batch updates instead of duplicating. Nothing is ever deleted.
 *
 * @param <T> incoming item type
 */
@Slf4j
public abstract class ChildCollectionUpserter<T> implements ListingChildUpserter {

    protected final StoreClient storeClient;

    protected ChildCollectionUpserter(StoreClient storeClient) {
        this.storeClient = storeClient;
    }

    protected abstract String entity();

    /** Store fields forming the natural key, in the order {@link #keyParts} returns them. */
    protected abstract List<String> keyFields();

    protected abstract List<T> items(ListingChildren children);

    /**
     * Natural-key values of an item, or empty to skip it. Implementations log
     * the reason for a skip.
     */
    protected abstract Optional<List<Object>> keyParts(T item);

    protected abstract Map<String, Object> values(long listingId, T item);

    /** Whether an item whose key already exists is written again or left alone. */
    protected boolean updatesExisting() {
        return true;
    }

    /** Hook for follow-up writes on a freshly created row. */
    protected void afterCreate(long rowId, T item) {
    }

    @Override
    public void upsert(long listingId, ListingChildren children) {
        List<T> items = items(children);
        if (items.isEmpty()) {
            log.info("No {} data to process for listing {}", name(), listingId);
            return;
        }
        log.info("Processing {} {} records for listing {}", items.size(), name(), listingId);

        Map<String, Long> existing = existingRows(listingId);
        int created = 0;
        int updated = 0;
        int skipped = 0;
        int refused = 0;

        for (T item : items) {
            Optional<List<Object>> parts = keyParts(item);
            if (parts.isEmpty()) {
                skipped++;
                continue;
            }
            String key = KeyParts.join(parts.get());
            Long rowId = existing.get(key);

            if (rowId == null) {
                long newId = storeClient.create(entity(), values(listingId, item));
                existing.put(key, newId);
                log.debug("Created {} row {} for key {}", name(), newId, parts.get());
                afterCreate(newId, item);
                created++;
            } else if (updatesExisting()) {
                if (storeClient.write(entity(), List.of(rowId), values(listingId, item))) {
                    log.debug("Updated {} row {} for key {}", name(), rowId, parts.get());
                    updated++;
                } else {
                    log.warn("Store refused update of {} row {} for key {}", name(), rowId, parts.get());
                    refused++;
                }
            } else {
                log.info("Skipping {} {}: already exists", name(), parts.get());
                skipped++;
            }
        }

        log.info("Completed {} for listing {}: {} created, {} updated, {} skipped, {} refused",
                name(), listingId, created, updated, skipped, refused);
    }

    private Map<String, Long> existingRows(long listingId) {
        List<String> fields = new ArrayList<>();
        fields.add("id");
        fields.addAll(keyFields());

        List<Map<String, Object>> rows = storeClient.searchRead(
                entity(), StoreCommands.where(StoreModels.PARENT_FIELD, listingId), fields);

        Map<String, Long> byKey = new HashMap<>();
        for (Map<String, Object> row : rows) {
            if (row.get("id") instanceof Number id) {
                List<Object> parts = new ArrayList<>();
                keyFields().forEach(field -> parts.add(row.get(field)));
                byKey.putIfAbsent(KeyParts.join(parts), id.longValue());
            }
        }
        return byKey;
    }
}
