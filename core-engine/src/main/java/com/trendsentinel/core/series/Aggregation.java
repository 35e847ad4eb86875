package com.trendsentinel.core.series;

import java.util.Locale;

/**
 * How observations falling in the same bucket are collapsed.
 *
 * @since 1.0.0
 */
public enum Aggregation {

    /** Sum of observation values. */
    SUM,
    /** Number of observations, ignoring their values. */
    COUNT,
    /** Arithmetic mean of observation values; ratio series use 1/0 indicators. */
    MEAN;

    public static Aggregation fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Aggregation must not be blank. Supported: sum, count, mean");
        }
        try {
            return valueOf(code.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Unknown aggregation: '" + code + "'. Supported: sum, count, mean", e);
        }
    }
}
