package com.trendsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * One point of a detector's evidence excerpt.
 *
 * <p>
 * {@code sma}/{@code ema} are only set by the moving-average detector and
 * {@code anomaly} only by the anomaly detector; the others leave them
 * {@code null}.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class EvidencePoint implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Instant date;
    private final double value;
    private final Double sma;
    private final Double ema;
    private final Boolean anomaly;

    private EvidencePoint(Instant date, double value, Double sma, Double ema, Boolean anomaly) {
        this.date = Objects.requireNonNull(date, "date must not be null");
        this.value = value;
        this.sma = sma;
        this.ema = ema;
        this.anomaly = anomaly;
    }

    public static EvidencePoint of(Instant date, double value) {
        return new EvidencePoint(date, value, null, null, null);
    }

    public static EvidencePoint smoothed(Instant date, double value, double sma, double ema) {
        return new EvidencePoint(date, value, sma, ema, null);
    }

    public static EvidencePoint flagged(Instant date, double value, boolean anomaly) {
        return new EvidencePoint(date, value, null, null, anomaly);
    }

    public Instant getDate() {
        return date;
    }

    public double getValue() {
        return value;
    }

    public Double getSma() {
        return sma;
    }

    public Double getEma() {
        return ema;
    }

    public Boolean getAnomaly() {
        return anomaly;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof EvidencePoint that))
            return false;
        return Double.compare(value, that.value) == 0
                && date.equals(that.date)
                && Objects.equals(sma, that.sma)
                && Objects.equals(ema, that.ema)
                && Objects.equals(anomaly, that.anomaly);
    }

    @Override
    public int hashCode() {
        return Objects.hash(date, value, sma, ema, anomaly);
    }

    @Override
    public String toString() {
        return "EvidencePoint{" + date + "=" + value + '}';
    }
}
