package com.trendsentinel.core.detection;

import java.util.Objects;

/**
 * Pure arithmetic kernels shared by the detectors.
 *
 * <p>
 * Every method is side-effect free and operates on a plain {@code double[]}
 * so it can be unit tested without building a series. Degenerate inputs
 * (empty arrays, zero variance) are reported through return values, never
 * through {@code NaN}.
 * </p>
 *
 * @since 1.0.0
 */
public final class SeriesStatistics {

    /** Relative tolerance below which a spread or total is treated as zero. */
    static final double EPSILON = 1e-9;

    private SeriesStatistics() {
        // utility class
    }

    // ---------------------------------------------------------------
    // Moments
    // ---------------------------------------------------------------

    /**
     * @param values non-empty array
     * @return arithmetic mean
     * @throws IllegalArgumentException if {@code values} is empty
     */
    public static double mean(double[] values) {
        requireNonEmpty(values);
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    /**
     * Population (not sample) standard deviation.
     *
     * @param values non-empty array
     * @param mean   mean of {@code values}
     * @return standard deviation, {@code >= 0}
     */
    public static double populationStdDev(double[] values, double mean) {
        requireNonEmpty(values);
        double sumSquaredDiff = 0;
        for (double v : values) {
            double diff = v - mean;
            sumSquaredDiff += diff * diff;
        }
        return Math.sqrt(sumSquaredDiff / values.length);
    }

    /**
     * Whether {@code magnitude} is indistinguishable from zero relative to
     * {@code scale} (typically the series mean).
     */
    public static boolean isNegligible(double magnitude, double scale) {
        return Math.abs(magnitude) <= EPSILON * Math.max(1.0, Math.abs(scale));
    }

    // ---------------------------------------------------------------
    // Smoothing
    // ---------------------------------------------------------------

    /**
     * Trailing simple moving average, aligned with the input.
     *
     * <p>
     * The first {@code window - 1} entries carry the raw value because a full
     * window is not yet available.
     * </p>
     *
     * @param values input values
     * @param window window size, {@code >= 1}
     * @return array of the same length as {@code values}
     */
    public static double[] simpleMovingAverage(double[] values, int window) {
        requireWindow(window);
        double[] sma = new double[values.length];
        double runningSum = 0;
        for (int i = 0; i < values.length; i++) {
            runningSum += values[i];
            if (i >= window) {
                runningSum -= values[i - window];
            }
            sma[i] = i < window - 1 ? values[i] : runningSum / window;
        }
        return sma;
    }

    /**
     * Exponential moving average with smoothing factor {@code 2 / (window + 1)}.
     *
     * <p>
     * Seeded with the mean of the first {@code window} values; each later
     * entry blends the current value with the previous average.
     * </p>
     *
     * @param values input values
     * @param window window size, {@code >= 1}
     * @return array of the same length as {@code values}
     */
    public static double[] exponentialMovingAverage(double[] values, int window) {
        requireWindow(window);
        double[] ema = new double[values.length];
        if (values.length == 0) {
            return ema;
        }
        double alpha = 2.0 / (window + 1);
        int seedLength = Math.min(window, values.length);
        double seed = 0;
        for (int i = 0; i < seedLength; i++) {
            seed += values[i];
        }
        ema[0] = seed / seedLength;
        for (int i = 1; i < values.length; i++) {
            ema[i] = values[i] * alpha + ema[i - 1] * (1 - alpha);
        }
        return ema;
    }

    // ---------------------------------------------------------------
    // Correlation
    // ---------------------------------------------------------------

    /**
     * Absolute Pearson correlation between the index sequence 0..n-1 and
     * {@code values}.
     *
     * @param values input values
     * @return |r| in [0, 1]; {@code 0} for fewer than two values or a
     *         zero-variance input
     */
    public static double absoluteCorrelationWithIndex(double[] values) {
        int n = values.length;
        if (n < 2) {
            return 0;
        }
        double meanX = (n - 1) / 2.0;
        double meanY = mean(values);

        double sxy = 0;
        double sxx = 0;
        double syy = 0;
        for (int i = 0; i < n; i++) {
            double dx = i - meanX;
            double dy = values[i] - meanY;
            sxy += dx * dy;
            sxx += dx * dx;
            syy += dy * dy;
        }

        if (isNegligible(Math.sqrt(syy / n), meanY)) {
            return 0;
        }
        return Math.min(1.0, Math.abs(sxy / Math.sqrt(sxx * syy)));
    }

    // ---------------------------------------------------------------
    // CUSUM
    // ---------------------------------------------------------------

    /**
     * Cumulative sum of deviations from the mean, reporting where its
     * magnitude peaks. The first maximum wins on ties.
     *
     * @param values non-empty array
     * @return index and signed value of the maximum-magnitude cumulative sum
     */
    public static Cusum cusum(double[] values) {
        double mean = mean(values);
        double running = 0;
        double extreme = 0;
        int index = 0;
        for (int i = 0; i < values.length; i++) {
            running += values[i] - mean;
            if (Math.abs(running) > Math.abs(extreme)) {
                extreme = running;
                index = i;
            }
        }
        return new Cusum(index, extreme, mean);
    }

    /**
     * Result of {@link #cusum(double[])}.
     */
    public static final class Cusum {
        private final int index;
        private final double value;
        private final double mean;

        Cusum(int index, double value, double mean) {
            this.index = index;
            this.value = value;
            this.mean = mean;
        }

        public int getIndex() {
            return index;
        }

        public double getValue() {
            return value;
        }

        public double getMean() {
            return mean;
        }
    }

    // ---------------------------------------------------------------
    // Spectrum
    // ---------------------------------------------------------------

    /**
     * Normalised DFT magnitude spectrum {@code |X_k| / n} for
     * {@code k = 0 .. ceil(n/2) - 1}. Index 0 is the DC component.
     *
     * @param values input values
     * @return magnitudes indexed by frequency bin
     */
    public static double[] magnitudeSpectrum(double[] values) {
        int n = values.length;
        int bins = (n + 1) / 2;
        double[] magnitudes = new double[bins];
        for (int k = 0; k < bins; k++) {
            double real = 0;
            double imag = 0;
            for (int t = 0; t < n; t++) {
                double angle = -2 * Math.PI * k * t / n;
                real += values[t] * Math.cos(angle);
                imag += values[t] * Math.sin(angle);
            }
            magnitudes[k] = Math.sqrt(real * real + imag * imag) / n;
        }
        return magnitudes;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static void requireNonEmpty(double[] values) {
        Objects.requireNonNull(values, "values must not be null");
        if (values.length == 0) {
            throw new IllegalArgumentException("values must not be empty");
        }
    }

    private static void requireWindow(int window) {
        if (window < 1) {
            throw new IllegalArgumentException("window must be >= 1, got: " + window);
        }
    }
}
