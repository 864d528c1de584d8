package com.listinglab.scraper.consumer;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.listinglab.scraper.model.ListingType;
import com.listinglab.scraper.model.ScrapeRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Reads a queue message body into a {@link ScrapeRequest}.
 *
 * Body shape:
 * <pre>
 * {"location": "...", "listing_type": "for_sale", "record_id": 42, "limit": 5,
 *  "source_url": "...", ...extra provider parameters}
 * </pre>
 * A positive {@code record_id} forces the limit to 1; zero or negative ids are ignored.
 */
@Component
@RequiredArgsConstructor
public class ScrapeRequestReader {

    private static final Set<String> KNOWN_KEYS = Set.of("location", "listing_type", "record_id", "limit", "source_url");
    private static final TypeReference<LinkedHashMap<String, Object>> EXTRA_PARAMS = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public ScrapeRequest read(byte[] body) throws InvalidScrapeRequestException {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (IOException e) {
            throw new InvalidScrapeRequestException("Message body is not valid JSON: " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new InvalidScrapeRequestException("Message body is not a JSON object");
        }

        String location = root.path("location").asText("").trim();
        if (location.isEmpty()) {
            throw new InvalidScrapeRequestException("No location provided in message");
        }

        ListingType listingType = ListingType.FOR_SALE;
        if (root.hasNonNull("listing_type")) {
            String raw = root.get("listing_type").asText();
            listingType = ListingType.fromWire(raw)
                    .orElseThrow(() -> new InvalidScrapeRequestException("Unknown listing_type: " + raw));
        }

        Long recordId = integer(root, "record_id");
        if (recordId != null && recordId <= 0) {
            recordId = null;
        }
        Integer limit = recordId != null ? Integer.valueOf(1) : limit(integer(root, "limit"));

        Map<String, Object> extra = new LinkedHashMap<>();
        objectMapper.convertValue(root, EXTRA_PARAMS).forEach((key, value) -> {
            if (!KNOWN_KEYS.contains(key)) {
                extra.put(key, value);
            }
        });

        return ScrapeRequest.builder()
                .location(location)
                .listingType(listingType)
                .recordId(recordId)
                .limit(limit)
                .sourceUrl(root.hasNonNull("source_url") ? root.get("source_url").asText() : null)
                .extraParameters(extra)
                .build();
    }

    private static Long integer(JsonNode root, String field) throws InvalidScrapeRequestException {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.canConvertToLong() && node.isIntegralNumber()) {
            return node.asLong();
        }
        if (node.isTextual()) {
            try {
                return Long.parseLong(node.asText().trim());
            } catch (NumberFormatException e) {
                throw new InvalidScrapeRequestException(field + " is not an integer: " + node.asText(), e);
            }
        }
        throw new InvalidScrapeRequestException(field + " is not an integer: " + node);
    }

    private static Integer limit(Long value) throws InvalidScrapeRequestException {
        if (value == null) {
            return null;
        }
        if (value < 1 || value > Integer.MAX_VALUE) {
            throw new InvalidScrapeRequestException("limit out of range: " + value);
        }
        return value.intValue();
    }
}
