package com.listinglab.scraper.mapping;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Conversions into the store's date formats.
 *
 * The store takes datetimes as "yyyy-MM-dd HH:mm:ss" and dates as "yyyy-MM-dd".
 * Offsets are dropped, not converted: "2025-07-16T01:04:52-04:00" becomes
 * "2025-07-16 01:04:52".
 */
@Slf4j
public final class DateTimes {

    public static final DateTimeFormatter STORE_DATETIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    public static final DateTimeFormatter STORE_DATE = DateTimeFormatter.ISO_LOCAL_DATE;
    public static final DateTimeFormatter STORE_TIME = DateTimeFormatter.ofPattern("HH:mm:ss");

    // Tried in order; the first that parses wins
    private static final List<Function<String, LocalDateTime>> PARSERS = List.of(
            value -> OffsetDateTime.parse(value).toLocalDateTime(),
            LocalDateTime::parse,
            value -> LocalDateTime.parse(value, STORE_DATETIME),
            value -> LocalDate.parse(value).atStartOfDay()
    );

    private static final Pattern ISO_DATETIME_PREFIX = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}.*");

    private DateTimes() {
    }

    /**
     * Datetime string in store format. Blank input gives "", input that is not a
     * recognisable date or datetime gives null (and a warning).
     */
    public static String toStoreDateTime(String value) {
        if (value == null || value.isBlank()) {
            return "";
        }
        Optional<LocalDateTime> parsed = parseDateTime(value.trim());
        if (parsed.isPresent()) {
            return parsed.get().format(STORE_DATETIME);
        }
        log.warn("Failed to parse datetime string '{}', leaving it out", value);
        return null;
    }

    /**
     * Calendar date part of a date or datetime string, e.g. "2024-03-01 12:00:00" → "2024-03-01".
     */
    public static Optional<String> toCalendarDate(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        Optional<LocalDateTime> parsed = parseDateTime(trimmed);
        if (parsed.isPresent()) {
            return Optional.of(parsed.get().toLocalDate().format(STORE_DATE));
        }
        // Unknown shape: keep whatever precedes the time part
        return Optional.of(trimmed.split("[ T]")[0]);
    }

    /**
     * Store representation of a java.time value, or empty for types it has no format for.
     */
    public static Optional<String> format(TemporalAccessor value) {
        if (value instanceof LocalDateTime ldt) {
            return Optional.of(ldt.format(STORE_DATETIME));
        }
        if (value instanceof OffsetDateTime odt) {
            return Optional.of(odt.toLocalDateTime().format(STORE_DATETIME));
        }
        if (value instanceof ZonedDateTime zdt) {
            return Optional.of(zdt.toLocalDateTime().format(STORE_DATETIME));
        }
        if (value instanceof Instant instant) {
            return Optional.of(LocalDateTime.ofInstant(instant, ZoneOffset.UTC).format(STORE_DATETIME));
        }
        if (value instanceof LocalDate date) {
            return Optional.of(date.format(STORE_DATE));
        }
        if (value instanceof LocalTime time) {
            return Optional.of(time.format(STORE_TIME));
        }
        return Optional.empty();
    }

    /**
     * Copy of a JSON tree with every ISO datetime string rewritten to store format.
     * Plain dates and other text are left alone.
     */
    public static JsonNode normalizeTree(JsonNode node) {
        if (node == null) {
            return null;
        }
        JsonNode copy = node.deepCopy();
        return rewrite(copy);
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private static JsonNode rewrite(JsonNode node) {
        if (node.isTextual()) {
            String text = node.asText();
            if (ISO_DATETIME_PREFIX.matcher(text).matches()) {
                return parseDateTime(text)
                        .<JsonNode>map(dt -> TextNode.valueOf(dt.format(STORE_DATETIME)))
                        .orElse(node);
            }
            return node;
        }
        if (node.isObject()) {
            ObjectNode object = (ObjectNode) node;
            List<String> names = new ArrayList<>();
            object.fieldNames().forEachRemaining(names::add);
            for (String name : names) {
                object.set(name, rewrite(object.get(name)));
            }
            return object;
        }
        if (node.isArray()) {
            ArrayNode array = (ArrayNode) node;
            for (int i = 0; i < array.size(); i++) {
                array.set(i, rewrite(array.get(i)));
            }
            return array;
        }
        return node;
    }

    private static Optional<LocalDateTime> parseDateTime(String value) {
        for (Function<String, LocalDateTime> parser : PARSERS) {
            Optional<LocalDateTime> parsed = tryParse(parser, value);
            if (parsed.isPresent()) {
                return parsed;
            }
        }
        return Optional.empty();
    }

    private static Optional<LocalDateTime> tryParse(Function<String, LocalDateTime> parser, String value) {
        try {
            return Optional.of(parser.apply(value));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
