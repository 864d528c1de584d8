package com.listinglab.scraper.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The store answers either with a bare value or with the same value wrapped in
 * an object under {@code result}. Everything read from the store goes through
 * {@link #normalize(JsonNode)} first.
 */
public final class StoreResponses {

    static final String RESULT_KEY = "result";

    private StoreResponses() {
    }

    public static JsonNode normalize(JsonNode body) {
        if (body == null || body.isMissingNode()) {
            return NullNode.getInstance();
        }
        if (body.isObject() && body.has(RESULT_KEY)) {
            return body.get(RESULT_KEY);
        }
        return body;
    }

    /**
     * Id of a freshly created row: either a scalar or the first element of a list.
     */
    public static Optional<Long> firstId(JsonNode result) {
        if (result == null || result.isNull()) {
            return Optional.empty();
        }
        if (result.isArray()) {
            return result.isEmpty() ? Optional.empty() : firstId(result.get(0));
        }
        if (result.canConvertToLong()) {
            return Optional.of(result.asLong());
        }
        if (result.isTextual() && result.asText().matches("\\d+")) {
            return Optional.of(Long.parseLong(result.asText()));
        }
        return Optional.empty();
    }

    public static List<Long> ids(JsonNode result) {
        List<Long> ids = new ArrayList<>();
        if (result == null || !result.isArray()) {
            return ids;
        }
        for (JsonNode node : result) {
            if (node.canConvertToLong()) {
                ids.add(node.asLong());
            }
        }
        return ids;
    }

    /**
     * Truthiness as the store means it: null, false, 0, empty text and empty
     * containers are all "no".
     */
    public static boolean isTruthy(JsonNode result) {
        if (result == null || result.isNull() || result.isMissingNode()) {
            return false;
        }
        if (result.isBoolean()) {
            return result.asBoolean();
        }
        if (result.isNumber()) {
            return result.asDouble() != 0d;
        }
        if (result.isTextual()) {
            return !result.asText().isEmpty();
        }
        return !result.isEmpty();
    }
}
