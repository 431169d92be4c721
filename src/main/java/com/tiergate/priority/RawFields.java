package com.tiergate.priority;

import java.util.Map;
import java.util.Optional;

/**
 * Lenient accessors for raw task maps.
 */
final class RawFields {

    private RawFields() {
    }

    static String getString(Map<String, Object> map, String key) {
        Object value = map.get(key);
        return value != null ? value.toString() : null;
    }

    /**
     * Positive whole number under the key; empty when missing, non-numeric or not positive.
     */
    static Optional<Long> getPositiveLong(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return Optional.empty();
        }
        long parsed;
        if (value instanceof Number number) {
            parsed = number.longValue();
        } else {
            try {
                parsed = Long.parseLong(value.toString().trim());
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return parsed > 0 ? Optional.of(parsed) : Optional.empty();
    }

    /**
     * Duration in (possibly fractional) seconds under the key, as whole milliseconds.
     * Empty when missing, non-numeric or not positive once rounded.
     */
    static Optional<Long> getPositiveSecondsAsMillis(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return Optional.empty();
        }
        double seconds;
        if (value instanceof Number number) {
            seconds = number.doubleValue();
        } else {
            try {
                seconds = Double.parseDouble(value.toString().trim());
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        if (!Double.isFinite(seconds)) {
            return Optional.empty();
        }
        long millis = Math.round(seconds * 1000);
        return millis > 0 ? Optional.of(millis) : Optional.empty();
    }
}
