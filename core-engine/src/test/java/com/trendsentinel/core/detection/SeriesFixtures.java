package com.trendsentinel.core.detection;

import com.trendsentinel.core.model.TimeSeries;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;

/**
 * Daily series used across the detector tests.
 */
final class SeriesFixtures {

    static final Instant DAY_ZERO = Instant.parse("2024-01-01T00:00:00Z");

    private SeriesFixtures() {
    }

    static TimeSeries daily(String metric, double... values) {
        return TimeSeries.evenlySpaced(metric, DAY_ZERO, Duration.ofDays(1), values);
    }

    static double[] constant(int n, double value) {
        double[] values = new double[n];
        Arrays.fill(values, value);
        return values;
    }

    static double[] step(int before, double low, int after, double high) {
        double[] values = new double[before + after];
        for (int i = 0; i < values.length; i++) {
            values[i] = i < before ? low : high;
        }
        return values;
    }

    /** Alternating 9 / 11 baseline with one outlier. */
    static double[] withOutlier(int n, int index, double outlier) {
        double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            values[i] = i % 2 == 0 ? 9 : 11;
        }
        values[index] = outlier;
        return values;
    }

    static double[] sinusoid(int n, int period, double level, double amplitude) {
        double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            values[i] = level + amplitude * Math.sin(2 * Math.PI * i / period);
        }
        return values;
    }
}
