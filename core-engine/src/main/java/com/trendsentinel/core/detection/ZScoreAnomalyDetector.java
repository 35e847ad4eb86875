package com.trendsentinel.core.detection;

import com.trendsentinel.core.model.AnomalyPoint;
import com.trendsentinel.core.model.DetectedTrend;
import com.trendsentinel.core.model.DetectorType;
import com.trendsentinel.core.model.EvidencePoint;
import com.trendsentinel.core.model.TimeSeries;
import com.trendsentinel.core.model.TrendEvidence;
import com.trendsentinel.core.series.KeywordExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Spike detector: flags points whose z-score exceeds
 * {@value #Z_THRESHOLD} standard deviations.
 *
 * <p>
 * Only anomalies in the most recent quarter of the series can raise a
 * candidate, so a spike that has long since passed does not surface as a new
 * trend. The representative anomaly is the recent one with the largest |z|;
 * the evidence still lists every anomaly in the series.
 * </p>
 *
 * @since 1.0.0
 */
public class ZScoreAnomalyDetector implements TrendDetector {

    private static final Logger LOG = LoggerFactory.getLogger(ZScoreAnomalyDetector.class);

    public static final String NAME = "anomaly";

    static final int MIN_LENGTH = 10;
    static final double Z_THRESHOLD = 2.5;
    static final double RECENT_FRACTION = 0.75;
    static final double Z_SATURATION = 4.0;
    static final double CONFIDENCE = 0.75;

    @Override
    public Optional<DetectedTrend> detect(TimeSeries series) {
        Objects.requireNonNull(series, "series must not be null");
        int n = series.size();
        if (n < MIN_LENGTH) {
            return Optional.empty();
        }

        double[] values = series.values();
        double mean = SeriesStatistics.mean(values);
        double stdDev = SeriesStatistics.populationStdDev(values, mean);
        if (mean == 0 || SeriesStatistics.isNegligible(stdDev, mean)) {
            return Optional.empty();
        }

        int recentFrom = (int) Math.floor(RECENT_FRACTION * n);
        boolean[] flags = new boolean[n];
        List<AnomalyPoint> anomalies = new ArrayList<>();
        int recentCount = 0;
        AnomalyPoint representative = null;
        for (int i = 0; i < n; i++) {
            double z = (values[i] - mean) / stdDev;
            if (Math.abs(z) <= Z_THRESHOLD) {
                continue;
            }
            flags[i] = true;
            AnomalyPoint anomaly = new AnomalyPoint(i, series.timestampAt(i), values[i], z);
            anomalies.add(anomaly);
            if (i < recentFrom) {
                continue;
            }
            recentCount++;
            if (representative == null || Math.abs(z) > Math.abs(representative.getZScore())) {
                representative = anomaly;
            }
        }
        if (representative == null) {
            return Optional.empty();
        }

        double growthRate = (representative.getValue() - mean) / mean * 100;
        if (!Double.isFinite(growthRate)) {
            return Optional.empty();
        }

        TrendEvidence.Builder evidence = TrendEvidence.builder()
                .anomalies(anomalies)
                .statistics(mean, stdDev);
        for (int i = 0; i < n; i++) {
            evidence.point(EvidencePoint.flagged(series.timestampAt(i), values[i], flags[i]));
        }

        LOG.debug("Series [{}]: {} anomalies ({} recent), strongest recent z={} at {}",
                series.getMetric(), anomalies.size(), recentCount, representative.getZScore(), representative.getDate());

        return Optional.of(DetectedTrend.builder()
                .name("Unusual spike in " + series.getMetric())
                .type(DetectorType.ANOMALY)
                .metric(series.getMetric())
                .strength(Math.min(Math.abs(representative.getZScore()) / Z_SATURATION, 1.0))
                .confidence(CONFIDENCE)
                .growthRatePercent(growthRate)
                .startDate(representative.getDate())
                .evidence(evidence.build())
                .keywords(KeywordExtractor.extract(series.getMetric()))
                .build());
    }

    @Override
    public String getName() {
        return NAME;
    }
}
