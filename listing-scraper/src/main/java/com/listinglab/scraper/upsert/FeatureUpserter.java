package com.listinglab.scraper.upsert;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
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
 * Feature groups ("Interior Features" / "Bedrooms" → ["Bedrooms: 3", ...]),
 * one row per (parent category, category) with the text items as a JSON list.
 */
@Component
@Order(40)
@Slf4j
public class FeatureUpserter extends ChildCollectionUpserter<RawListing.FeatureDetail> {

    private final ObjectMapper objectMapper;

    public FeatureUpserter(StoreClient storeClient, ObjectMapper objectMapper) {
        super(storeClient);
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return "features";
    }

    @Override
    protected String entity() {
        return StoreModels.FEATURE;
    }

    @Override
    protected List<String> keyFields() {
        return List.of("parent_category", "category");
    }

    @Override
    protected List<RawListing.FeatureDetail> items(ListingChildren children) {
        return children.getFeatures();
    }

    @Override
    protected Optional<List<Object>> keyParts(RawListing.FeatureDetail detail) {
        if (detail == null || detail.getCategory() == null || detail.getCategory().isBlank()) {
            log.warn("Feature record missing category, skipping: {}", detail);
            return Optional.empty();
        }
        return Optional.of(List.of(parentCategory(detail), detail.getCategory()));
    }

    @Override
    protected Map<String, Object> values(long listingId, RawListing.FeatureDetail detail) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put(StoreModels.PARENT_FIELD, listingId);
        values.put("category", detail.getCategory());
        values.put("parent_category", parentCategory(detail));
        values.put("text_items", textItems(detail));
        return values;
    }

    private String textItems(RawListing.FeatureDetail detail) {
        try {
            return objectMapper.writeValueAsString(detail.getText());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise feature text for " + detail.getCategory(), e);
        }
    }

    private static String parentCategory(RawListing.FeatureDetail detail) {
        return detail.getParentCategory() == null ? "" : detail.getParentCategory();
    }
}
