package com.listinglab.scraper.consumer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.listinglab.scraper.model.ListingType;
import com.listinglab.scraper.model.ScrapeRequest;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScrapeRequestReaderTest {

    private final ScrapeRequestReader reader = new ScrapeRequestReader(new ObjectMapper());

    private ScrapeRequest read(String json) throws InvalidScrapeRequestException {
        return reader.read(json.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void readsKnownFieldsAndForwardsTheRest() throws Exception {
        ScrapeRequest request = read("{\"location\": \"Austin, TX\", \"listing_type\": \"SOLD\", \"limit\": 20,"
                + " \"source_url\": \"https://listings.example/x\", \"radius\": 5, \"past_days\": 30}");

        assertThat(request.getLocation()).isEqualTo("Austin, TX");
        assertThat(request.getListingType()).isEqualTo(ListingType.SOLD);
        assertThat(request.getLimit()).isEqualTo(20);
        assertThat(request.getRecordId()).isNull();
        assertThat(request.isDirectUpdate()).isFalse();
        assertThat(request.getSourceUrl()).isEqualTo("https://listings.example/x");
        assertThat(request.getExtraParameters()).containsOnlyKeys("radius", "past_days");
    }

    @Test
    void listingTypeDefaultsToForSale() throws Exception {
        assertThat(read("{\"location\": \"78701\"}").getListingType()).isEqualTo(ListingType.FOR_SALE);
    }

    @Test
    void recordIdForcesLimitOfOne() throws Exception {
        ScrapeRequest request = read("{\"location\": \"1 Main St\", \"record_id\": \"42\", \"limit\": 10}");

        assertThat(request.getRecordId()).isEqualTo(42L);
        assertThat(request.getLimit()).isEqualTo(1);
        assertThat(request.isDirectUpdate()).isTrue();
    }

    @Test
    void nonPositiveRecordIdIsIgnored() throws Exception {
        ScrapeRequest zero = read("{\"location\": \"1 Main St\", \"record_id\": 0, \"limit\": 5}");
        ScrapeRequest negative = read("{\"location\": \"1 Main St\", \"record_id\": -3}");

        assertThat(zero.isDirectUpdate()).isFalse();
        assertThat(zero.getLimit()).isEqualTo(5);
        assertThat(negative.getRecordId()).isNull();
    }

    @Test
    void limitOutsideIntegerRangeIsRejected() {
        assertThatThrownBy(() -> read("{\"location\": \"Austin\", \"limit\": 3000000000}"))
                .isInstanceOf(InvalidScrapeRequestException.class)
                .hasMessageContaining("limit");
        assertThatThrownBy(() -> read("{\"location\": \"Austin\", \"limit\": 0}"))
                .isInstanceOf(InvalidScrapeRequestException.class);
    }

    @Test
    void missingOrBlankLocationIsRejected() {
        assertThatThrownBy(() -> read("{\"listing_type\": \"for_sale\"}"))
                .isInstanceOf(InvalidScrapeRequestException.class)
                .hasMessageContaining("location");
        assertThatThrownBy(() -> read("{\"location\": \"   \"}"))
                .isInstanceOf(InvalidScrapeRequestException.class);
    }

    @Test
    void unknownListingTypeIsRejected() {
        assertThatThrownBy(() -> read("{\"location\": \"Austin\", \"listing_type\": \"auction\"}"))
                .isInstanceOf(InvalidScrapeRequestException.class)
                .hasMessageContaining("auction");
    }

    @Test
    void malformedBodiesAreRejected() {
        assertThatThrownBy(() -> read("{not json")).isInstanceOf(InvalidScrapeRequestException.class);
        assertThatThrownBy(() -> read("[\"Austin\"]")).isInstanceOf(InvalidScrapeRequestException.class);
        assertThatThrownBy(() -> read("{\"location\": \"Austin\", \"record_id\": \"abc\"}"))
                .isInstanceOf(InvalidScrapeRequestException.class);
    }
}
