package com.trendsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * A point flagged by the z-score test, with its absolute z-score.
 *
 * @since 1.0.0
 */
public final class AnomalyPoint implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int index;
    private final Instant date;
    private final double value;
    private final double zScore;

    public AnomalyPoint(int index, Instant date, double value, double zScore) {
        this.index = index;
        this.date = Objects.requireNonNull(date, "date must not be null");
        this.value = value;
        this.zScore = zScore;
    }

    /**
     * @return position of the point in the analysed series
     */
    public int getIndex() {
        return index;
    }

    public Instant getDate() {
        return date;
    }

    public double getValue() {
        return value;
    }

    public double getZScore() {
        return zScore;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnomalyPoint that))
            return false;
        return index == that.index
                && Double.compare(value, that.value) == 0
                && Double.compare(zScore, that.zScore) == 0
                && date.equals(that.date);
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, date, value, zScore);
    }

    @Override
    public String toString() {
        return "AnomalyPoint{index=" + index + ", date=" + date + ", value=" + value + ", z=" + zScore + '}';
    }
}
