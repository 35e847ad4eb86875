package com.trendsentinel.core.series;

import com.trendsentinel.core.model.Observation;
import com.trendsentinel.core.model.SeriesPoint;
import com.trendsentinel.core.model.TimeSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Collapses raw observations for one metric into a bucketed {@link TimeSeries}.
 *
 * <p>
 * Observations outside {@code [start, end)} are dropped. Buckets without any
 * observation are omitted rather than filled, so the resulting series is
 * date-ordered but not necessarily uniform. The input may arrive in any order.
 * </p>
 *
 * <p>
 * This class is stateless and thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public final class SeriesBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(SeriesBuilder.class);

    private final Bucket bucket;
    private final Aggregation aggregation;

    public SeriesBuilder(Bucket bucket, Aggregation aggregation) {
        this.bucket = Objects.requireNonNull(bucket, "bucket must not be null");
        this.aggregation = Objects.requireNonNull(aggregation, "aggregation must not be null");
    }

    /**
     * @return a builder producing one point per UTC day, counting observations
     */
    public static SeriesBuilder dailyCounts() {
        return new SeriesBuilder(Bucket.DAY, Aggregation.COUNT);
    }

    /**
     * Build the series for {@code metric}.
     *
     * @param metric       metric label carried by the series
     * @param observations raw observations; must not be {@code null}
     * @param start        inclusive window start
     * @param end          exclusive window end
     * @return bucketed series, possibly empty
     * @throws IllegalArgumentException if {@code start} is after {@code end}
     */
    public TimeSeries build(String metric, List<Observation> observations, Instant start, Instant end) {
        Objects.requireNonNull(metric, "metric must not be null");
        Objects.requireNonNull(observations, "observations must not be null");
        Objects.requireNonNull(start, "start must not be null");
        Objects.requireNonNull(end, "end must not be null");
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("Window start " + start + " is after end " + end);
        }

        // bucket → {sum of values, number of observations}
        Map<Instant, double[]> buckets = new TreeMap<>();
        int dropped = 0;
        for (Observation observation : observations) {
            Instant ts = observation.getTimestamp();
            if (ts.isBefore(start) || !ts.isBefore(end)) {
                dropped++;
                continue;
            }
            double[] acc = buckets.computeIfAbsent(bucket.truncate(ts), k -> new double[2]);
            acc[0] += observation.getValue();
            acc[1]++;
        }

        if (dropped > 0) {
            LOG.trace("Series [{}]: dropped {} observation(s) outside {} .. {}", metric, dropped, start, end);
        }

        List<SeriesPoint> points = new ArrayList<>(buckets.size());
        buckets.forEach((timestamp, acc) -> points.add(new SeriesPoint(timestamp, collapse(acc))));
        return new TimeSeries(metric, points);
    }

    /**
     * The builder to use for {@code metric}: derived metrics carry their own
     * aggregation, every other metric uses this builder's.
     *
     * @param metric metric label
     * @return this builder, or one with the same bucket and the derived
     *         metric's aggregation
     */
    public SeriesBuilder forMetric(String metric) {
        return DerivedMetric.fromName(metric)
                .filter(derived -> derived.getAggregation() != aggregation)
                .map(derived -> new SeriesBuilder(bucket, derived.getAggregation()))
                .orElse(this);
    }

    private double collapse(double[] acc) {
        return switch (aggregation) {
            case SUM -> acc[0];
            case COUNT -> acc[1];
            case MEAN -> acc[0] / acc[1];
        };
    }

    public Bucket getBucket() {
        return bucket;
    }

    public Aggregation getAggregation() {
        return aggregation;
    }
}
