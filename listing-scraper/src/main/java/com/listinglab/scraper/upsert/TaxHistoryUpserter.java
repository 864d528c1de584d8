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

/**
 * One row per listing and tax year.
 */
@Component
@Order(30)
@Slf4j
public class TaxHistoryUpserter extends ChildCollectionUpserter<RawListing.TaxHistoryEntry> {

    public TaxHistoryUpserter(StoreClient storeClient) {
        super(storeClient);
    }

    @Override
    public String name() {
        return "tax history";
    }

    @Override
    protected String entity() {
        return StoreModels.TAX_HISTORY;
    }

    @Override
    protected List<String> keyFields() {
        return List.of("year");
    }

    @Override
    protected List<RawListing.TaxHistoryEntry> items(ListingChildren children) {
        return children.getTaxHistory();
    }

    @Override
    protected Optional<List<Object>> keyParts(RawListing.TaxHistoryEntry entry) {
        if (entry == null || entry.getYear() == null || entry.getYear() == 0) {
            log.warn("Tax history record missing year, skipping: {}", entry);
            return Optional.empty();
        }
        return Optional.of(List.of(entry.getYear()));
    }

    @Override
    protected Map<String, Object> values(long listingId, RawListing.TaxHistoryEntry entry) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put(StoreModels.PARENT_FIELD, listingId);
        values.put("year", entry.getYear());
        values.put("tax", orZero(entry.getTax()));
        if (entry.getAssessedYear() != null) {
            values.put("assessed_year", entry.getAssessedYear());
        }
        values.put("value", orZero(entry.getValue()));

        RawListing.Assessment assessment = entry.getAssessment();
        if (assessment != null) {
            values.put("assessment_total", orZero(assessment.getTotal()));
            values.put("assessment_building", orZero(assessment.getBuilding()));
            values.put("assessment_land", orZero(assessment.getLand()));
        }
        if (entry.getAppraisal() != null) {
            values.put("appraisal", entry.getAppraisal());
        }
        if (entry.getMarket() != null) {
            values.put("market", entry.getMarket());
        }
        return values;
    }

    private static double orZero(Double val) {
        return val == null ? 0.0 : val;
    }
}
