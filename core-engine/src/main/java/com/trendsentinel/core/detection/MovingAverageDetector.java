package com.trendsentinel.core.detection;

import com.trendsentinel.core.model.DetectedTrend;
import com.trendsentinel.core.model.DetectorType;
import com.trendsentinel.core.model.EvidencePoint;
import com.trendsentinel.core.model.TimeSeries;
import com.trendsentinel.core.model.TrendEvidence;
import com.trendsentinel.core.series.KeywordExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Sustained growth / decline detector based on moving averages.
 *
 * <p>
 * Smooths the series with a simple moving average of
 * {@code min(7, n / 3)} points and compares the first and last smoothed
 * values. The trend strength is the absolute correlation between the
 * smoothed curve and time. A candidate is reported when the growth is at
 * least {@value #MIN_GROWTH_PERCENT}% in either direction or the strength is
 * at least {@value #MIN_STRENGTH}.
 * </p>
 *
 * @since 1.0.0
 */
public class MovingAverageDetector implements TrendDetector {

    private static final Logger LOG = LoggerFactory.getLogger(MovingAverageDetector.class);

    public static final String NAME = "moving_average";

    static final int MIN_LENGTH = 7;
    static final int MAX_WINDOW = 7;
    static final double MIN_GROWTH_PERCENT = 50.0;
    static final double MIN_STRENGTH = 0.5;
    static final double CONFIDENCE = 0.7;

    @Override
    public Optional<DetectedTrend> detect(TimeSeries series) {
        Objects.requireNonNull(series, "series must not be null");
        int n = series.size();
        if (n < MIN_LENGTH) {
            return Optional.empty();
        }

        double[] values = series.values();
        int window = Math.min(MAX_WINDOW, n / 3);
        double[] sma = SeriesStatistics.simpleMovingAverage(values, window);
        double[] ema = SeriesStatistics.exponentialMovingAverage(values, window);

        double firstSma = sma[0];
        double lastSma = sma[n - 1];
        if (firstSma == 0) {
            LOG.trace("Series [{}]: first SMA is zero, growth undefined", series.getMetric());
            return Optional.empty();
        }
        double growthRate = (lastSma - firstSma) / firstSma * 100;
        if (!Double.isFinite(growthRate)) {
            return Optional.empty();
        }

        double strength = SeriesStatistics.absoluteCorrelationWithIndex(sma);
        if (Math.abs(growthRate) < MIN_GROWTH_PERCENT && strength < MIN_STRENGTH) {
            return Optional.empty();
        }

        boolean growing = growthRate > 0;
        List<String> keywords = KeywordExtractor.extract(series.getMetric());

        TrendEvidence.Builder evidence = TrendEvidence.builder().keywords(keywords);
        for (int i = 0; i < n; i++) {
            evidence.point(EvidencePoint.smoothed(series.timestampAt(i), values[i], sma[i], ema[i]));
        }

        LOG.debug("Series [{}]: moving-average trend growth={}% strength={}",
                series.getMetric(), growthRate, strength);

        return Optional.of(DetectedTrend.builder()
                .name((growing ? "Growing" : "Declining") + " trend in " + series.getMetric())
                .type(growing ? DetectorType.GROWTH : DetectorType.DECLINE)
                .metric(series.getMetric())
                .strength(strength)
                .confidence(CONFIDENCE)
                .growthRatePercent(growthRate)
                .startDate(series.timestampAt(0))
                .peakDate(peakDate(series, values))
                .evidence(evidence.build())
                .keywords(keywords)
                .build());
    }

    private static Instant peakDate(TimeSeries series, double[] values) {
        int peak = 0;
        for (int i = 1; i < values.length; i++) {
            if (values[i] > values[peak]) {
                peak = i;
            }
        }
        return series.timestampAt(peak);
    }

    @Override
    public String getName() {
        return NAME;
    }
}
