package com.listinglab.scraper.store;

import java.util.Collection;
import java.util.List;

/**
 * Builders for the search domains and relation commands understood by the store.
 */
public final class StoreCommands {

    /** Relation command code that replaces every link with the given ids. */
    static final int REPLACE_ALL = 6;

    private StoreCommands() {
    }

    /**
     * Single-clause domain: {@code [[field, "=", value]]}.
     */
    public static List<List<Object>> where(String field, Object value) {
        return List.of(List.of(field, "=", value));
    }

    /**
     * Replace-all-links command for a many-to-many field: {@code [[6, 0, ids]]}.
     */
    public static List<List<Object>> replaceLinks(Collection<Long> ids) {
        return List.of(List.of(REPLACE_ALL, 0, List.copyOf(ids)));
    }
}
