package com.listinglab.scraper.upsert;

import com.listinglab.scraper.store.StoreClient;
import com.listinglab.scraper.store.StoreCommands;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Find-or-create for lookup rows (tags, photo tags, schools) identified by a
 * single text field. Returns ids in first-seen order with duplicates removed.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class TagResolver {

    private final StoreClient storeClient;

    public List<Long> resolve(String entity, String keyField, Collection<String> keys,
                              Function<String, Map<String, Object>> newRow) {
        LinkedHashSet<Long> ids = new LinkedHashSet<>();
        for (String key : new LinkedHashSet<>(keys)) {
            if (key == null || key.isBlank()) {
                continue;
            }
            List<Long> found = storeClient.search(entity, StoreCommands.where(keyField, key));
            if (!found.isEmpty()) {
                ids.add(found.get(0));
            } else {
                long created = storeClient.create(entity, newRow.apply(key));
                log.debug("Created {} {}={} as {}", entity, keyField, key, created);
                ids.add(created);
            }
        }
        return new ArrayList<>(ids);
    }

    public List<Long> resolve(String entity, String keyField, Collection<String> keys) {
        return resolve(entity, keyField, keys, key -> Map.of(keyField, key));
    }
}
