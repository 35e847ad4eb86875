package com.trendsentinel.core.series;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.Locale;

/**
 * Bucket width used to collapse observations into a series. All boundaries
 * are UTC.
 *
 * @since 1.0.0
 */
public enum Bucket {

    HOUR,
    DAY,
    /** ISO weeks, starting on Monday. */
    WEEK;

    /**
     * @param timestamp any instant
     * @return start of the bucket containing {@code timestamp}
     */
    public Instant truncate(Instant timestamp) {
        return switch (this) {
            case HOUR -> timestamp.truncatedTo(ChronoUnit.HOURS);
            case DAY -> timestamp.truncatedTo(ChronoUnit.DAYS);
            case WEEK -> LocalDate.ofInstant(timestamp, ZoneOffset.UTC)
                    .with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY))
                    .atStartOfDay(ZoneOffset.UTC)
                    .toInstant();
        };
    }

    public static Bucket fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Bucket must not be blank. Supported: hour, day, week");
        }
        try {
            return valueOf(code.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Unknown bucket: '" + code + "'. Supported: hour, day, week", e);
        }
    }
}
