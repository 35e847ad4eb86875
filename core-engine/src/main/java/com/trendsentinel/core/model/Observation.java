package com.trendsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * A single raw, time-stamped observation as supplied by an event source.
 *
 * <p>
 * Plain event counts use a value of {@code 1}; the series builder collapses
 * observations into buckets either by summing values or by counting them.
 * </p>
 *
 * @since 1.0.0
 */
public final class Observation implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Instant timestamp;
    private final double value;

    /**
     * @param timestamp when the observation happened; must not be {@code null}
     * @param value     observed value
     * @throws NullPointerException if {@code timestamp} is {@code null}
     */
    public Observation(Instant timestamp, double value) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.value = value;
    }

    /**
     * Create a count observation (value {@code 1}).
     *
     * @param timestamp when the event happened
     * @return new observation
     */
    public static Observation count(Instant timestamp) {
        return new Observation(timestamp, 1.0);
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public double getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Observation that))
            return false;
        return Double.compare(value, that.value) == 0 && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, value);
    }

    @Override
    public String toString() {
        return "Observation{" + timestamp + "=" + value + '}';
    }
}
