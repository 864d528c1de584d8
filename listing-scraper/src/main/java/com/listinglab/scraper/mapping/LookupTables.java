package com.listinglab.scraper.mapping;

import java.util.Locale;
import java.util.Map;

final class LookupTables {

    private LookupTables() {
    }

    /**
     * Exact (case-insensitive) lookup, then substring match in table iteration
     * order, then the fallback.
     */
    static <T> T resolve(Map<String, T> table, String text, T fallback) {
        if (text == null || text.isBlank()) {
            return fallback;
        }
        String key = text.trim().toLowerCase(Locale.ROOT);
        T exact = table.get(key);
        if (exact != null) {
            return exact;
        }
        for (Map.Entry<String, T> entry : table.entrySet()) {
            if (key.contains(entry.getKey())) {
                return entry.getValue();
            }
        }
        return fallback;
    }
}
