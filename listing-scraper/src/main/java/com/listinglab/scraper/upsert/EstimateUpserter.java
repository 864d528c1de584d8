package com.listinglab.scraper.upsert;

import com.listinglab.scraper.mapping.DateTimes;
import com.listinglab.scraper.model.ListingChildren;
import com.listinglab.scraper.model.RawListing;
import com.listinglab.scraper.store.StoreClient;
import com.listinglab.scraper.store.StoreModels;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Value estimates, one row per (date, source name, source type).
 * Dates are keyed as plain calendar dates so a re-scrape of the same day's
 * estimate lands on the same row whatever time of day the provider reports.
 */
@Component
@Order(50)
@Slf4j
public class EstimateUpserter extends ChildCollectionUpserter<RawListing.CurrentEstimate> {

    public EstimateUpserter(StoreClient storeClient) {
        super(storeClient);
    }

    @Override
    public String name() {
        return "estimates";
    }

    @Override
    protected String entity() {
        return StoreModels.ESTIMATE;
    }

    @Override
    protected List<String> keyFields() {
        return List.of("date", "source_name", "source_type");
    }

    @Override
    protected List<RawListing.CurrentEstimate> items(ListingChildren children) {
        return children.getEstimates();
    }

    @Override
    protected Optional<List<Object>> keyParts(RawListing.CurrentEstimate estimate) {
        Optional<String> date = estimate == null ? Optional.empty() : DateTimes.toCalendarDate(estimate.getDate());
        if (date.isEmpty()) {
            log.warn("Estimate record missing date, skipping: {}", estimate);
            return Optional.empty();
        }
        return Optional.of(List.of(date.get(), sourceName(estimate), sourceType(estimate)));
    }

    @Override
    protected Map<String, Object> values(long listingId, RawListing.CurrentEstimate estimate) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put(StoreModels.PARENT_FIELD, listingId);
        values.put("date", DateTimes.toCalendarDate(estimate.getDate()).orElse(""));
        values.put("estimate", orZero(estimate.getEstimate()));
        values.put("estimate_high", orZero(estimate.getEstimateHigh()));
        values.put("estimate_low", orZero(estimate.getEstimateLow()));
        values.put("is_best_home_value", Boolean.TRUE.equals(estimate.getIsBestHomeValue()));
        values.put("source_name", sourceName(estimate));
        values.put("source_type", sourceType(estimate));
        return values;
    }

    private static String sourceName(RawListing.CurrentEstimate estimate) {
        String name = estimate.getSource().getName();
        return name == null ? "" : name;
    }

    private static String sourceType(RawListing.CurrentEstimate estimate) {
        String type = estimate.getSource().getType();
        return type == null ? "" : type;
    }

    private static double orZero(Double val) {
        return val == null ? 0.0 : val;
    }
}
