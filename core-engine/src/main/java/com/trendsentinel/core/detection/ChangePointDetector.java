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
import java.util.Objects;
import java.util.Optional;

/**
 * Abrupt level-shift detector using a cumulative-sum (CUSUM) statistic.
 *
 * <p>
 * The point where the cumulative deviation from the mean peaks is taken as
 * the change point. It is reported when the peak exceeds
 * {@value #THRESHOLD_RATIO} × mean and lies beyond the first
 * {@value #MIN_CHANGE_INDEX} points, which suppresses flags caused by a noisy
 * start of the series.
 * </p>
 *
 * @since 1.0.0
 */
public class ChangePointDetector implements TrendDetector {

    private static final Logger LOG = LoggerFactory.getLogger(ChangePointDetector.class);

    public static final String NAME = "change_point";

    static final int MIN_LENGTH = 20;
    static final double THRESHOLD_RATIO = 0.3;
    static final int MIN_CHANGE_INDEX = 10;
    static final int EVIDENCE_POINTS = 20;
    static final double CONFIDENCE = 0.65;

    @Override
    public Optional<DetectedTrend> detect(TimeSeries series) {
        Objects.requireNonNull(series, "series must not be null");
        int n = series.size();
        if (n < MIN_LENGTH) {
            return Optional.empty();
        }

        double[] values = series.values();
        SeriesStatistics.Cusum cusum = SeriesStatistics.cusum(values);
        double threshold = cusum.getMean() * THRESHOLD_RATIO;

        // a non-positive mean makes the relative threshold meaningless
        if (threshold <= 0) {
            return Optional.empty();
        }
        int changeIndex = cusum.getIndex();
        if (Math.abs(cusum.getValue()) <= threshold || changeIndex < MIN_CHANGE_INDEX) {
            return Optional.empty();
        }

        double atChange = values[changeIndex];
        if (atChange == 0) {
            return Optional.empty();
        }
        double growthRate = (values[n - 1] - atChange) / atChange * 100;
        if (!Double.isFinite(growthRate)) {
            return Optional.empty();
        }

        Instant changeDate = series.timestampAt(changeIndex);
        TrendEvidence.Builder evidence = TrendEvidence.builder().changePoint(changeDate);
        for (int i = n - EVIDENCE_POINTS; i < n; i++) {
            evidence.point(EvidencePoint.of(series.timestampAt(i), values[i]));
        }

        LOG.debug("Series [{}]: change point at index {} ({}), cusum={} threshold={}",
                series.getMetric(), changeIndex, changeDate, cusum.getValue(), threshold);

        return Optional.of(DetectedTrend.builder()
                .name("Significant change detected in " + series.getMetric())
                .type(DetectorType.CHANGE_POINT)
                .metric(series.getMetric())
                .strength(Math.min(Math.abs(cusum.getValue()) / threshold, 1.0))
                .confidence(CONFIDENCE)
                .growthRatePercent(growthRate)
                .startDate(changeDate)
                .evidence(evidence.build())
                .keywords(KeywordExtractor.extract(series.getMetric()))
                .build());
    }

    @Override
    public String getName() {
        return NAME;
    }
}
