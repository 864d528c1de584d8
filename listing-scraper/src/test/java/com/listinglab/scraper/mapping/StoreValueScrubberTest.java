package com.listinglab.scraper.mapping;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.listinglab.scraper.model.MarketStatus;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class StoreValueScrubberTest {

    private final StoreValueScrubber scrubber = new StoreValueScrubber(new ObjectMapper());

    @Test
    void dropsNullsAndKeepsJsonNativeValues() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("name", "x");
        values.put("price", 1.5);
        values.put("active", true);
        values.put("gone", null);
        values.put("ids", List.of(1, 2));

        assertThat(scrubber.scrub(values))
                .containsOnlyKeys("name", "price", "active", "ids")
                .containsEntry("ids", List.of(1, 2));
    }

    @Test
    void formatsTemporalAndEnumValues() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("listing_date", LocalDateTime.of(2025, 7, 16, 1, 4, 52));
        values.put("nested", Map.of("day", LocalDate.of(2025, 7, 16)));
        values.put("market_status", MarketStatus.CONTINGENT);

        Map<String, Object> scrubbed = scrubber.scrub(values);

        assertThat(scrubbed).containsEntry("listing_date", "2025-07-16 01:04:52");
        assertThat(scrubbed).containsEntry("nested", Map.of("day", "2025-07-16"));
        assertThat(scrubbed).containsEntry("market_status", "contingent");
    }

    @Test
    void unserialisableValueFallsBackToItsString() {
        Object opaque = new Object() {
            @Override
            public String toString() {
                return "opaque-value";
            }
        };

        assertThat(scrubber.scrub(Map.of("blob", opaque))).containsEntry("blob", "opaque-value");
    }

    @Test
    void valueWithoutStringFormIsSkipped() {
        Object broken = new Object() {
            @Override
            public String toString() {
                throw new IllegalStateException("no string form");
            }
        };

        assertThat(scrubber.scrub(Map.of("broken", broken, "kept", "yes")))
                .containsOnlyKeys("kept");
    }
}
