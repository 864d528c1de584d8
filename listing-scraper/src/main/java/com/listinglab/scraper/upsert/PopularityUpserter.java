package com.listinglab.scraper.upsert;

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

@Component
@Order(20)
@Slf4j
public class PopularityUpserter extends ChildCollectionUpserter<RawListing.PopularityPeriod> {

    public PopularityUpserter(StoreClient storeClient) {
        super(storeClient);
    }

    @Override
    public String name() {
        return "popularity";
    }

    @Override
    protected String entity() {
        return StoreModels.POPULARITY;
    }

    @Override
    protected List<String> keyFields() {
        return List.of("last_n_days");
    }

    @Override
    protected List<RawListing.PopularityPeriod> items(ListingChildren children) {
        return children.getPopularityPeriods();
    }

    @Override
    protected Optional<List<Object>> keyParts(RawListing.PopularityPeriod period) {
        if (period == null || period.getLastNDays() == null || period.getLastNDays() == 0) {
            log.debug("Popularity period without last_n_days, skipping: {}", period);
            return Optional.empty();
        }
        return Optional.of(List.of(period.getLastNDays()));
    }

    @Override
    protected Map<String, Object> values(long listingId, RawListing.PopularityPeriod period) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put(StoreModels.PARENT_FIELD, listingId);
        values.put("last_n_days", period.getLastNDays());
        values.put("views_total", orZero(period.getViewsTotal()));
        values.put("clicks_total", orZero(period.getClicksTotal()));
        values.put("saves_total", orZero(period.getSavesTotal()));
        values.put("shares_total", orZero(period.getSharesTotal()));
        values.put("leads_total", orZero(period.getLeadsTotal()));
        values.put("dwell_time_mean", orZero(period.getDwellTimeMean()));
        values.put("dwell_time_median", orZero(period.getDwellTimeMedian()));
        return values;
    }

    private static int orZero(Integer val) {
        return val == null ? 0 : val;
    }

    private static double orZero(Double val) {
        return val == null ? 0.0 : val;
    }
}
