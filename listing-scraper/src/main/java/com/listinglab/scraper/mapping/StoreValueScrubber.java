package com.listinglab.scraper.mapping;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Last pass before a value map goes to the store.
 *
 * Top-level nulls are dropped so the store keeps whatever it already has.
 * JSON-native values pass through, java.time values are formatted, anything
 * Jackson cannot serialise is sent as its string form.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class StoreValueScrubber {

    private final ObjectMapper objectMapper;

    public Map<String, Object> scrub(Map<String, ?> values) {
        Map<String, Object> scrubbed = new LinkedHashMap<>();
        values.forEach((key, value) -> {
            if (value != null) {
                scrubValue(key, value).ifPresent(clean -> scrubbed.put(key, clean));
            }
        });
        return scrubbed;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private Optional<Object> scrubValue(String key, Object value) {
        if (value == null
                || value instanceof String
                || value instanceof Number
                || value instanceof Boolean
                || value instanceof JsonNode) {
            return Optional.ofNullable(value);
        }
        if (value instanceof TemporalAccessor temporal) {
            Optional<String> formatted = DateTimes.format(temporal);
            if (formatted.isPresent()) {
                return Optional.of(formatted.get());
            }
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> nested = new LinkedHashMap<>();
            map.forEach((k, v) -> nested.put(String.valueOf(k), scrubValue(key, v).orElse(null)));
            return Optional.of(nested);
        }
        if (value instanceof Collection<?> collection) {
            List<Object> nested = new ArrayList<>(collection.size());
            for (Object item : collection) {
                nested.add(scrubValue(key, item).orElse(null));
            }
            return Optional.of(nested);
        }
        if (value instanceof Enum<?>) {
            return Optional.ofNullable(objectMapper.convertValue(value, Object.class));
        }
        return serialisableOrString(key, value);
    }

    private Optional<Object> serialisableOrString(String key, Object value) {
        try {
            return Optional.of(objectMapper.valueToTree(value));
        } catch (IllegalArgumentException e) {
            log.debug("Value for key {} is not JSON-serialisable: {}", key, e.getMessage());
        }

        try {
            String text = String.valueOf(value);
            log.warn("Converted non-serializable value for key {} to string: {}", key, text);
            return Optional.of(text);
        } catch (RuntimeException e) {
            log.warn("Skipping non-serializable value for key {}: {}, error: {}",
                    key, value.getClass().getName(), e.getMessage());
            return Optional.empty();
        }
    }
}
