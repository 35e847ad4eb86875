package com.trendsentinel.core.series;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Look-back window of an analysis run, e.g. {@code {value: 30, unit: days}}.
 *
 * <p>
 * Supported units: {@code hours}, {@code days}, {@code weeks},
 * {@code months}. Months are calendar months in UTC.
 * </p>
 *
 * @since 1.0.0
 */
public class TimeWindow implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final List<String> UNITS = List.of("hours", "days", "weeks", "months");

    private int value;
    private String unit;

    /** No-arg constructor required by SnakeYAML. */
    public TimeWindow() {
        this(7, "days");
    }

    public TimeWindow(int value, String unit) {
        this.value = value;
        setUnit(unit);
    }

    /**
     * Resolve the start of the window ending at {@code end}.
     *
     * @param end exclusive end of the window
     * @return inclusive start of the window
     * @throws IllegalStateException if the window is invalid
     */
    public Instant startBefore(Instant end) {
        Objects.requireNonNull(end, "end must not be null");
        validate();
        return switch (unit) {
            case "hours" -> end.minus(Duration.ofHours(value));
            case "days" -> end.minus(Duration.ofDays(value));
            case "weeks" -> end.minus(Duration.ofDays(7L * value));
            default -> end.atZone(ZoneOffset.UTC).minusMonths(value).toInstant();
        };
    }

    /**
     * @throws IllegalStateException if {@code value} is not positive or the unit
     *                               is unknown
     */
    public void validate() {
        if (value < 1) {
            throw new IllegalStateException("timeWindow.value must be >= 1, got: " + value);
        }
        if (unit == null || !UNITS.contains(unit)) {
            throw new IllegalStateException(
                    "Unknown timeWindow.unit: '" + unit + "'. Supported: " + String.join(", ", UNITS));
        }
    }

    public int getValue() {
        return value;
    }

    public void setValue(int value) {
        this.value = value;
    }

    public String getUnit() {
        return unit;
    }

    public void setUnit(String unit) {
        this.unit = unit != null ? unit.trim().toLowerCase(Locale.ROOT) : null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TimeWindow that))
            return false;
        return value == that.value && Objects.equals(unit, that.unit);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, unit);
    }

    @Override
    public String toString() {
        return value + " " + unit;
    }
}
