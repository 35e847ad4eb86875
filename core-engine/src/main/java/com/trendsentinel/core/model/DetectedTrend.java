package com.trendsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Raw candidate produced by a single detector for a single series.
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code name}, {@code type}, {@code metric},
 * {@code startDate} and {@code evidence} are required. {@code strength} and
 * {@code confidence} must lie in [0, 1] and {@code growthRatePercent} must be
 * finite; violating either throws {@link IllegalArgumentException} at build
 * time, so a degenerate computation can never leak into a stored trend.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectedTrend implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String name;
    private final DetectorType type;
    private final String metric;
    private final double strength;
    private final double confidence;
    private final double growthRatePercent;
    private final Instant startDate;
    private final Instant peakDate;
    private final TrendEvidence evidence;
    private final List<String> keywords;

    private DetectedTrend(Builder b) {
        this.name = Objects.requireNonNull(b.name, "name must not be null");
        this.type = Objects.requireNonNull(b.type, "type must not be null");
        this.metric = Objects.requireNonNull(b.metric, "metric must not be null");
        this.startDate = Objects.requireNonNull(b.startDate, "startDate must not be null");
        this.evidence = Objects.requireNonNull(b.evidence, "evidence must not be null");
        this.strength = requireUnitInterval(b.strength, "strength");
        this.confidence = requireUnitInterval(b.confidence, "confidence");
        if (!Double.isFinite(b.growthRatePercent)) {
            throw new IllegalArgumentException("growthRatePercent must be finite, got: " + b.growthRatePercent);
        }
        this.growthRatePercent = b.growthRatePercent;
        this.peakDate = b.peakDate;
        this.keywords = Collections.unmodifiableList(new ArrayList<>(b.keywords));
    }

    private static double requireUnitInterval(double value, String field) {
        if (!(value >= 0.0 && value <= 1.0)) {
            throw new IllegalArgumentException(field + " must be in [0, 1], got: " + value);
        }
        return value;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link DetectedTrend}.
     */
    public static class Builder {
        private String name;
        private DetectorType type;
        private String metric;
        private double strength;
        private double confidence;
        private double growthRatePercent;
        private Instant startDate;
        private Instant peakDate;
        private TrendEvidence evidence;
        private final List<String> keywords = new ArrayList<>();

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder type(DetectorType type) {
            this.type = type;
            return this;
        }

        public Builder metric(String metric) {
            this.metric = metric;
            return this;
        }

        public Builder strength(double strength) {
            this.strength = strength;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder growthRatePercent(double growthRatePercent) {
            this.growthRatePercent = growthRatePercent;
            return this;
        }

        public Builder startDate(Instant startDate) {
            this.startDate = startDate;
            return this;
        }

        public Builder peakDate(Instant peakDate) {
            this.peakDate = peakDate;
            return this;
        }

        public Builder evidence(TrendEvidence evidence) {
            this.evidence = evidence;
            return this;
        }

        public Builder keywords(List<String> keywords) {
            this.keywords.clear();
            this.keywords.addAll(keywords);
            return this;
        }

        /**
         * @return a new {@link DetectedTrend}
         * @throws NullPointerException     if a required field is missing
         * @throws IllegalArgumentException if a numeric field is out of range
         */
        public DetectedTrend build() {
            return new DetectedTrend(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getName() {
        return name;
    }

    public DetectorType getType() {
        return type;
    }

    public String getMetric() {
        return metric;
    }

    public double getStrength() {
        return strength;
    }

    public double getConfidence() {
        return confidence;
    }

    public double getGrowthRatePercent() {
        return growthRatePercent;
    }

    public Instant getStartDate() {
        return startDate;
    }

    /**
     * @return date of the highest observed value, or {@code null} when the
     *         detector does not report one
     */
    public Instant getPeakDate() {
        return peakDate;
    }

    public TrendEvidence getEvidence() {
        return evidence;
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
        if (!(o instanceof DetectedTrend that))
            return false;
        return Double.compare(strength, that.strength) == 0
                && Double.compare(confidence, that.confidence) == 0
                && Double.compare(growthRatePercent, that.growthRatePercent) == 0
                && name.equals(that.name)
                && type == that.type
                && metric.equals(that.metric)
                && startDate.equals(that.startDate)
                && Objects.equals(peakDate, that.peakDate)
                && evidence.equals(that.evidence)
                && keywords.equals(that.keywords);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, metric, strength, confidence, growthRatePercent,
                startDate, peakDate, evidence, keywords);
    }

    @Override
    public String toString() {
        return "DetectedTrend{" +
                "name='" + name + '\'' +
                ", type=" + type.getCode() +
                ", metric='" + metric + '\'' +
                ", strength=" + strength +
                ", confidence=" + confidence +
                ", growthRatePercent=" + growthRatePercent +
                ", startDate=" + startDate +
                '}';
    }
}
