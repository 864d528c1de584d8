package com.listinglab.scraper.mapping;

import com.listinglab.scraper.model.MarketStatus;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps the provider's free-text listing status onto {@link MarketStatus}.
 * Exact match first, then the first table key contained in the text, then off-market.
 */
public final class MarketStatusNormalizer {

    private static final Map<String, MarketStatus> STATUS_TABLE = new LinkedHashMap<>();

    static {
        STATUS_TABLE.put("for_sale", MarketStatus.ACTIVE);
        STATUS_TABLE.put("for_rent", MarketStatus.ACTIVE);
        STATUS_TABLE.put("active", MarketStatus.ACTIVE);
        STATUS_TABLE.put("pending", MarketStatus.CONTINGENT);
        STATUS_TABLE.put("contingent", MarketStatus.CONTINGENT);
        STATUS_TABLE.put("sold", MarketStatus.OFF_MARKET);
        STATUS_TABLE.put("off_market", MarketStatus.OFF_MARKET);
    }

    public static final MarketStatus DEFAULT = MarketStatus.OFF_MARKET;

    private MarketStatusNormalizer() {
    }

    public static MarketStatus normalize(String status) {
        return LookupTables.resolve(STATUS_TABLE, status, DEFAULT);
    }
}
