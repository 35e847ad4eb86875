package com.trendsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Granularity of a {@link Trend}, inferred from the evidence sample count.
 *
 * @since 1.0.0
 */
public enum TimePeriod {

    DAY("day", 7),
    WEEK("week", 30),
    MONTH("month", 90),
    QUARTER("quarter", 180),
    YEAR("year", Integer.MAX_VALUE);

    private final String code;

    /** Largest sample count that still maps to this period. */
    private final int maxSamples;

    TimePeriod(String code, int maxSamples) {
        this.code = code;
        this.maxSamples = maxSamples;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * Infer the period from the number of samples backing a trend.
     *
     * @param sampleCount number of evidence points
     * @return the smallest period whose upper bound covers {@code sampleCount}
     */
    public static TimePeriod forSampleCount(int sampleCount) {
        for (TimePeriod period : values()) {
            if (sampleCount <= period.maxSamples) {
                return period;
            }
        }
        return YEAR;
    }
}
