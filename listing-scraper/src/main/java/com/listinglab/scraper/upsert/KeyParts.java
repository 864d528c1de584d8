package com.listinglab.scraper.upsert;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Turns natural-key values into a comparable string. Values read back from the
 * store and values built from provider data must produce the same key.
 */
final class KeyParts {

    private static final String SEPARATOR = "\u001f";

    private KeyParts() {
    }

    static String join(List<?> parts) {
        return parts.stream().map(KeyParts::text).collect(Collectors.joining(SEPARATOR));
    }

    /**
     * The store reports an empty text field as {@code false}; both mean "".
     * Integral numbers lose any trailing ".0" so 2023 and 2023.0 agree.
     */
    static String text(Object value) {
        if (value == null || Boolean.FALSE.equals(value)) {
            return "";
        }
        if (value instanceof Number number) {
            double d = number.doubleValue();
            if (d == Math.rint(d) && !Double.isInfinite(d)) {
                return Long.toString(number.longValue());
            }
            return number.toString();
        }
        return value.toString();
    }
}
