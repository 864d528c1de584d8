package com.listinglab.scraper.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Sub-collection payloads extracted from one raw listing.
 */
@Value
@Builder
public class ListingChildren {

    @Builder.Default
    List<JsonNode> photos = List.of();

    /** Detail-size URLs, index-aligned with {@link #photos}. */
    @Builder.Default
    List<String> altPhotos = List.of();

    @Builder.Default
    List<RawListing.TaxHistoryEntry> taxHistory = List.of();

    @Builder.Default
    List<RawListing.CurrentEstimate> estimates = List.of();

    @Builder.Default
    List<RawListing.PopularityPeriod> popularityPeriods = List.of();

    @Builder.Default
    List<RawListing.FeatureDetail> features = List.of();

    /** Listing tag api-names, e.g. {@code community_gym}. */
    @Builder.Default
    List<String> tags = List.of();

    @Builder.Default
    List<String> nearbySchools = List.of();
}
