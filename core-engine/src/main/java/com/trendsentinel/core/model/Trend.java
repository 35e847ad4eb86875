package com.trendsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Canonical, persisted trend record.
 *
 * <p>
 * Produced by the trend classifier from a {@link DetectedTrend} that passed
 * the significance gate. Instances are immutable; the store assigns the
 * identifier and detection timestamp.
 * </p>
 *
 * @since 1.0.0
 */
public final class Trend implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String trendName;
    private final TrendType trendType;
    private final String metric;
    private final double currentValue;
    private final double previousValue;
    private final double changePercent;
    private final TimePeriod timePeriod;
    private final double significance;
    private final Instant startDate;
    private final List<String> keywords;

    private Trend(Builder b) {
        this.trendName = Objects.requireNonNull(b.trendName, "trendName must not be null");
        this.trendType = Objects.requireNonNull(b.trendType, "trendType must not be null");
        this.metric = Objects.requireNonNull(b.metric, "metric must not be null");
        this.timePeriod = Objects.requireNonNull(b.timePeriod, "timePeriod must not be null");
        this.startDate = Objects.requireNonNull(b.startDate, "startDate must not be null");
        this.currentValue = b.currentValue;
        this.previousValue = b.previousValue;
        this.changePercent = b.changePercent;
        this.significance = b.significance;
        this.keywords = Collections.unmodifiableList(new ArrayList<>(b.keywords));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Trend}.
     */
    public static class Builder {
        private String trendName;
        private TrendType trendType;
        private String metric;
        private double currentValue;
        private double previousValue;
        private double changePercent;
        private TimePeriod timePeriod;
        private double significance;
        private Instant startDate;
        private final List<String> keywords = new ArrayList<>();

        public Builder trendName(String trendName) {
            this.trendName = trendName;
            return this;
        }

        public Builder trendType(TrendType trendType) {
            this.trendType = trendType;
            return this;
        }

        public Builder metric(String metric) {
            this.metric = metric;
            return this;
        }

        public Builder currentValue(double currentValue) {
            this.currentValue = currentValue;
            return this;
        }

        public Builder previousValue(double previousValue) {
            this.previousValue = previousValue;
            return this;
        }

        public Builder changePercent(double changePercent) {
            this.changePercent = changePercent;
            return this;
        }

        public Builder timePeriod(TimePeriod timePeriod) {
            this.timePeriod = timePeriod;
            return this;
        }

        public Builder significance(double significance) {
            this.significance = significance;
            return this;
        }

        public Builder startDate(Instant startDate) {
            this.startDate = startDate;
            return this;
        }

        public Builder keywords(List<String> keywords) {
            this.keywords.clear();
            this.keywords.addAll(keywords);
            return this;
        }

        public Trend build() {
            return new Trend(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getTrendName() {
        return trendName;
    }

    public TrendType getTrendType() {
        return trendType;
    }

    public String getMetric() {
        return metric;
    }

    public double getCurrentValue() {
        return currentValue;
    }

    public double getPreviousValue() {
        return previousValue;
    }

    public double getChangePercent() {
        return changePercent;
    }

    public TimePeriod getTimePeriod() {
        return timePeriod;
    }

    public double getSignificance() {
        return significance;
    }

    public Instant getStartDate() {
        return startDate;
    }

    public List<String> getKeywords() {
        return keywords;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Trend that))
            return false;
        return Double.compare(currentValue, that.currentValue) == 0
                && Double.compare(previousValue, that.previousValue) == 0
                && Double.compare(changePercent, that.changePercent) == 0
                && Double.compare(significance, that.significance) == 0
                && trendName.equals(that.trendName)
                && trendType == that.trendType
                && metric.equals(that.metric)
                && timePeriod == that.timePeriod
                && startDate.equals(that.startDate)
                && keywords.equals(that.keywords);
    }

    @Override
    public int hashCode() {
        return Objects.hash(trendName, trendType, metric, currentValue, previousValue,
                changePercent, timePeriod, significance, startDate, keywords);
    }

    @Override
    public String toString() {
        return "Trend{" +
                "trendName='" + trendName + '\'' +
                ", trendType=" + trendType.getCode() +
                ", metric='" + metric + '\'' +
                ", currentValue=" + currentValue +
                ", previousValue=" + previousValue +
                ", changePercent=" + changePercent +
                ", timePeriod=" + timePeriod.getCode() +
                ", significance=" + significance +
                '}';
    }
}
