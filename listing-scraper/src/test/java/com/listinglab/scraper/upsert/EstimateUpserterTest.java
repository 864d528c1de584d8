package com.listinglab.scraper.upsert;

import com.listinglab.scraper.model.ListingChildren;
import com.listinglab.scraper.model.RawListing;
import com.listinglab.scraper.store.InMemoryStoreClient;
import com.listinglab.scraper.store.StoreModels;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class EstimateUpserterTest {

    private InMemoryStoreClient store;
    private EstimateUpserter upserter;

    @BeforeEach
    void setUp() {
        store = new InMemoryStoreClient();
        upserter = new EstimateUpserter(store);
    }

    private static RawListing.CurrentEstimate estimate(String date, String sourceName, double value) {
        RawListing.CurrentEstimate estimate = new RawListing.CurrentEstimate();
        estimate.setDate(date);
        estimate.setEstimate(value);
        estimate.getSource().setName(sourceName);
        return estimate;
    }

    @Test
    void storedEmptySourceMatchesMissingSource() {
        // the store reads unset text fields back as false
        long existing = store.insert(StoreModels.ESTIMATE, Map.of(
                StoreModels.PARENT_FIELD, 1L, "date", "2025-07-01", "source_name", "", "source_type", ""));

        upserter.upsert(1L, ListingChildren.builder()
                .estimates(List.of(estimate("2025-07-01T00:00:00Z", null, 530000.0)))
                .build());

        assertThat(store.rows(StoreModels.ESTIMATE)).hasSize(1);
        assertThat(store.row(StoreModels.ESTIMATE, existing)).containsEntry("estimate", 530000.0);
    }

    @Test
    void differentSourcesOnSameDateAreSeparateRows() {
        upserter.upsert(1L, ListingChildren.builder()
                .estimates(List.of(
                        estimate("2025-07-01", "Quantarium", 530000.0),
                        estimate("2025-07-01", "Collateral", 520000.0),
                        estimate(null, "Quantarium", 1.0)))
                .build());

        assertThat(store.rows(StoreModels.ESTIMATE).values())
                .extracting(row -> row.get("source_name"))
                .containsExactly("Quantarium", "Collateral");
        assertThat(store.rows(StoreModels.ESTIMATE).values())
                .allSatisfy(row -> assertThat(row)
                        .containsEntry("date", "2025-07-01")
                        .containsEntry("is_best_home_value", false));
    }
}
