package com.trendsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Evidence payload attached to a {@link DetectedTrend}.
 *
 * <p>
 * Every detector fills {@link #getTimeSeries()}; the remaining fields are
 * detector-specific and stay {@code null} (or empty) when not applicable:
 * </p>
 * <ul>
 * <li>change point: {@code changePoint}</li>
 * <li>seasonality: {@code frequency}, {@code period}, {@code periodName},
 * {@code power}</li>
 * <li>anomaly: {@code anomalies}, {@code mean}, {@code stdDev}</li>
 * <li>moving average: {@code keywords}</li>
 * </ul>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class TrendEvidence implements Serializable {

    private static final long serialVersionUID = 1L;

    private final List<EvidencePoint> timeSeries;
    private final Instant changePoint;
    private final Integer frequency;
    private final Integer period;
    private final String periodName;
    private final Double power;
    private final List<AnomalyPoint> anomalies;
    private final Double mean;
    private final Double stdDev;
    private final List<String> keywords;

    private TrendEvidence(Builder b) {
        this.timeSeries = Collections.unmodifiableList(new ArrayList<>(b.timeSeries));
        this.changePoint = b.changePoint;
        this.frequency = b.frequency;
        this.period = b.period;
        this.periodName = b.periodName;
        this.power = b.power;
        this.anomalies = Collections.unmodifiableList(new ArrayList<>(b.anomalies));
        this.mean = b.mean;
        this.stdDev = b.stdDev;
        this.keywords = Collections.unmodifiableList(new ArrayList<>(b.keywords));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link TrendEvidence}.
     */
    public static class Builder {
        private final List<EvidencePoint> timeSeries = new ArrayList<>();
        private Instant changePoint;
        private Integer frequency;
        private Integer period;
        private String periodName;
        private Double power;
        private final List<AnomalyPoint> anomalies = new ArrayList<>();
        private Double mean;
        private Double stdDev;
        private final List<String> keywords = new ArrayList<>();

        public Builder point(EvidencePoint point) {
            this.timeSeries.add(Objects.requireNonNull(point, "point must not be null"));
            return this;
        }

        public Builder timeSeries(List<EvidencePoint> points) {
            this.timeSeries.clear();
            this.timeSeries.addAll(points);
            return this;
        }

        public Builder changePoint(Instant changePoint) {
            this.changePoint = changePoint;
            return this;
        }

        public Builder frequency(int frequency) {
            this.frequency = frequency;
            return this;
        }

        public Builder period(int period) {
            this.period = period;
            return this;
        }

        public Builder periodName(String periodName) {
            this.periodName = periodName;
            return this;
        }

        public Builder power(double power) {
            this.power = power;
            return this;
        }

        public Builder anomalies(List<AnomalyPoint> anomalies) {
            this.anomalies.clear();
            this.anomalies.addAll(anomalies);
            return this;
        }

        public Builder statistics(double mean, double stdDev) {
            this.mean = mean;
            this.stdDev = stdDev;
            return this;
        }

        public Builder keywords(List<String> keywords) {
            this.keywords.clear();
            this.keywords.addAll(keywords);
            return this;
        }

        public TrendEvidence build() {
            return new TrendEvidence(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public List<EvidencePoint> getTimeSeries() {
        return timeSeries;
    }

    public int sampleCount() {
        return timeSeries.size();
    }

    public Instant getChangePoint() {
        return changePoint;
    }

    public Integer getFrequency() {
        return frequency;
    }

    public Integer getPeriod() {
        return period;
    }

    public String getPeriodName() {
        return periodName;
    }

    public Double getPower() {
        return power;
    }

    public List<AnomalyPoint> getAnomalies() {
        return anomalies;
    }

    public Double getMean() {
        return mean;
    }

    public Double getStdDev() {
        return stdDev;
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
        if (!(o instanceof TrendEvidence that))
            return false;
        return timeSeries.equals(that.timeSeries)
                && Objects.equals(changePoint, that.changePoint)
                && Objects.equals(frequency, that.frequency)
                && Objects.equals(period, that.period)
                && Objects.equals(periodName, that.periodName)
                && Objects.equals(power, that.power)
                && anomalies.equals(that.anomalies)
                && Objects.equals(mean, that.mean)
                && Objects.equals(stdDev, that.stdDev)
                && keywords.equals(that.keywords);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timeSeries, changePoint, frequency, period, periodName, power,
                anomalies, mean, stdDev, keywords);
    }

    @Override
    public String toString() {
        return "TrendEvidence{" +
                "samples=" + timeSeries.size() +
                ", changePoint=" + changePoint +
                ", period=" + period +
                ", anomalies=" + anomalies.size() +
                ", keywords=" + keywords +
                '}';
    }
}
