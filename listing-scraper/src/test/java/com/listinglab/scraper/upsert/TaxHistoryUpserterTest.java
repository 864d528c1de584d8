package com.listinglab.scraper.upsert;

import com.listinglab.scraper.model.ListingChildren;
import com.listinglab.scraper.model.RawListing;
import com.listinglab.scraper.store.InMemoryStoreClient;
import com.listinglab.scraper.store.StoreModels;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@ExtendWith(OutputCaptureExtension.class)
class TaxHistoryUpserterTest {

    private InMemoryStoreClient store;
    private TaxHistoryUpserter upserter;

    @BeforeEach
    void setUp() {
        store = new InMemoryStoreClient();
        upserter = new TaxHistoryUpserter(store);
    }

    private static RawListing.TaxHistoryEntry entry(Integer year, double tax) {
        RawListing.TaxHistoryEntry entry = new RawListing.TaxHistoryEntry();
        entry.setYear(year);
        entry.setTax(tax);
        return entry;
    }

    @Test
    void recordWithoutYearIsSkippedAndTheRestStillWritten() {
        RawListing.Assessment assessment = new RawListing.Assessment();
        assessment.setTotal(480000.0);
        RawListing.TaxHistoryEntry withAssessment = entry(2023, 9800.5);
        withAssessment.setAssessment(assessment);

        upserter.upsert(1L, ListingChildren.builder()
                .taxHistory(List.of(entry(null, 50.0), withAssessment, entry(2022, 9100.0)))
                .build());

        assertThat(store.rows(StoreModels.TAX_HISTORY).values())
                .extracting(row -> row.get("year"))
                .containsExactly(2023, 2022);
        Map<String, Object> first = store.rows(StoreModels.TAX_HISTORY).values().iterator().next();
        assertThat(first)
                .containsEntry("assessment_total", 480000.0)
                .containsEntry("assessment_land", 0.0)
                .doesNotContainKey("market");
    }

    @Test
    void secondRunUpdatesSameYearInsteadOfCreating() {
        upserter.upsert(1L, ListingChildren.builder().taxHistory(List.of(entry(2023, 9800.0))).build());
        upserter.upsert(1L, ListingChildren.builder().taxHistory(List.of(entry(2023, 9900.0))).build());

        assertThat(store.rows(StoreModels.TAX_HISTORY)).hasSize(1);
        assertThat(store.rows(StoreModels.TAX_HISTORY).values().iterator().next()).containsEntry("tax", 9900.0);
    }

    @Test
    void refusedUpdateIsReportedNotCounted(CapturedOutput output) {
        long existing = store.insert(StoreModels.TAX_HISTORY, Map.of(StoreModels.PARENT_FIELD, 1L, "year", 2023, "tax", 9800.0));
        store.refuseWrites();

        upserter.upsert(1L, ListingChildren.builder().taxHistory(List.of(entry(2023, 9900.0))).build());

        assertThat(store.row(StoreModels.TAX_HISTORY, existing)).containsEntry("tax", 9800.0);
        assertThat(output)
                .contains("Store refused update of tax history row " + existing)
                .contains("0 updated, 0 skipped, 1 refused");
    }

    @Test
    void rowsOfOtherListingsAreNotMatched() {
        store.insert(StoreModels.TAX_HISTORY, Map.of(StoreModels.PARENT_FIELD, 2L, "year", 2023));

        upserter.upsert(1L, ListingChildren.builder().taxHistory(List.of(entry(2023, 9800.0))).build());

        assertThat(store.rows(StoreModels.TAX_HISTORY)).hasSize(2);
    }
}
