package com.trendsentinel.core.model;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Single-metric, date-ordered numeric series.
 *
 * <p>
 * Timestamps are <strong>strictly increasing</strong>; the constructor rejects
 * any other ordering. Buckets may be missing (the series builder never
 * interpolates), so consumers must not assume uniform spacing.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Instances are immutable and may be shared across worker threads.
 * </p>
 *
 * @since 1.0.0
 */
public final class TimeSeries implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String metric;
    private final List<SeriesPoint> points;

    /**
     * @param metric metric label, e.g. {@code feedback_volume}
     * @param points date-ordered points
     * @throws NullPointerException     if {@code metric} or {@code points} is
     *                                  {@code null}
     * @throws IllegalArgumentException if timestamps are not strictly increasing
     */
    public TimeSeries(String metric, List<SeriesPoint> points) {
        this.metric = Objects.requireNonNull(metric, "metric must not be null");
        Objects.requireNonNull(points, "points must not be null");

        for (int i = 1; i < points.size(); i++) {
            Instant previous = points.get(i - 1).getTimestamp();
            Instant current = points.get(i).getTimestamp();
            if (!current.isAfter(previous)) {
                throw new IllegalArgumentException(
                        "Timestamps must be strictly increasing in series '" + metric
                                + "': " + previous + " followed by " + current);
            }
        }
        this.points = Collections.unmodifiableList(new ArrayList<>(points));
    }

    /**
     * Build an evenly spaced series from raw values.
     *
     * @param metric metric label
     * @param start  timestamp of the first point
     * @param step   spacing between points; must be positive
     * @param values point values in order
     * @return new series
     */
    public static TimeSeries evenlySpaced(String metric, Instant start, Duration step, double... values) {
        Objects.requireNonNull(start, "start must not be null");
        Objects.requireNonNull(step, "step must not be null");
        if (step.isZero() || step.isNegative()) {
            throw new IllegalArgumentException("step must be positive, got: " + step);
        }
        List<SeriesPoint> points = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            points.add(new SeriesPoint(start.plus(step.multipliedBy(i)), values[i]));
        }
        return new TimeSeries(metric, points);
    }

    public String getMetric() {
        return metric;
    }

    /**
     * @return unmodifiable list of points
     */
    public List<SeriesPoint> getPoints() {
        return points;
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    public Instant timestampAt(int index) {
        return points.get(index).getTimestamp();
    }

    public double valueAt(int index) {
        return points.get(index).getValue();
    }

    /**
     * @return a fresh copy of the point values
     */
    public double[] values() {
        double[] values = new double[points.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = points.get(i).getValue();
        }
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TimeSeries that))
            return false;
        return metric.equals(that.metric) && points.equals(that.points);
    }

    @Override
    public int hashCode() {
        return Objects.hash(metric, points);
    }

    @Override
    public String toString() {
        return "TimeSeries{metric='" + metric + "', size=" + points.size() + '}';
    }
}
