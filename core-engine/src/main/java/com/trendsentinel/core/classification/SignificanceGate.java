package com.trendsentinel.core.classification;

import com.trendsentinel.core.model.DetectedTrend;
import com.trendsentinel.core.model.DetectorType;

import java.io.Serializable;
import java.util.Objects;

/**
 * Decides whether a raw candidate is notable enough to become a
 * {@link com.trendsentinel.core.model.Trend}.
 *
 * <p>
 * A candidate passes when its absolute growth rate reaches
 * {@code minGrowthRatePercent}, or when it is an anomaly whose strength is
 * strictly above {@code minAnomalyStrength}.
 * </p>
 *
 * @since 1.0.0
 */
public final class SignificanceGate implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final double DEFAULT_MIN_GROWTH_RATE_PERCENT = 300.0;
    public static final double DEFAULT_MIN_ANOMALY_STRENGTH = 0.7;

    private final double minGrowthRatePercent;
    private final double minAnomalyStrength;

    public SignificanceGate(double minGrowthRatePercent, double minAnomalyStrength) {
        if (!Double.isFinite(minGrowthRatePercent) || minGrowthRatePercent < 0) {
            throw new IllegalArgumentException(
                    "minGrowthRatePercent must be a non-negative number, got: " + minGrowthRatePercent);
        }
        if (!(minAnomalyStrength >= 0 && minAnomalyStrength <= 1)) {
            throw new IllegalArgumentException(
                    "minAnomalyStrength must be in [0, 1], got: " + minAnomalyStrength);
        }
        this.minGrowthRatePercent = minGrowthRatePercent;
        this.minAnomalyStrength = minAnomalyStrength;
    }

    /**
     * @return a gate with the default thresholds (300 % / 0.7)
     */
    public static SignificanceGate defaults() {
        return new SignificanceGate(DEFAULT_MIN_GROWTH_RATE_PERCENT, DEFAULT_MIN_ANOMALY_STRENGTH);
    }

    public boolean isSignificant(DetectedTrend candidate) {
        Objects.requireNonNull(candidate, "candidate must not be null");
        if (Math.abs(candidate.getGrowthRatePercent()) >= minGrowthRatePercent) {
            return true;
        }
        return candidate.getType() == DetectorType.ANOMALY
                && candidate.getStrength() > minAnomalyStrength;
    }

    public double getMinGrowthRatePercent() {
        return minGrowthRatePercent;
    }

    public double getMinAnomalyStrength() {
        return minAnomalyStrength;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SignificanceGate that))
            return false;
        return Double.compare(minGrowthRatePercent, that.minGrowthRatePercent) == 0
                && Double.compare(minAnomalyStrength, that.minAnomalyStrength) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(minGrowthRatePercent, minAnomalyStrength);
    }

    @Override
    public String toString() {
        return "SignificanceGate{" +
                "minGrowthRatePercent=" + minGrowthRatePercent +
                ", minAnomalyStrength=" + minAnomalyStrength +
                '}';
    }
}
