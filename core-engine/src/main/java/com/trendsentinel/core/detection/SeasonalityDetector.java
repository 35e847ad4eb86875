package com.trendsentinel.core.detection;

import com.trendsentinel.core.model.DetectedTrend;
import com.trendsentinel.core.model.DetectorType;
import com.trendsentinel.core.model.EvidencePoint;
import com.trendsentinel.core.model.TimeSeries;
import com.trendsentinel.core.model.TrendEvidence;
import com.trendsentinel.core.series.KeywordExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Recurring-cycle detector based on the discrete Fourier transform.
 *
 * <h3>Algorithm</h3>
 * <ol>
 * <li>Compute the magnitude spectrum {@code |X_k| / n}.</li>
 * <li>Ignore the DC bin (k = 0); it only carries the series level.</li>
 * <li>Pick the dominant bin (first maximum wins) and normalise its power
 * against the total non-DC magnitude.</li>
 * <li>Report a seasonal pattern when the power reaches
 * {@value #MIN_POWER}.</li>
 * </ol>
 *
 * @since 1.0.0
 */
public class SeasonalityDetector implements TrendDetector {

    private static final Logger LOG = LoggerFactory.getLogger(SeasonalityDetector.class);

    public static final String NAME = "seasonality";

    static final int MIN_LENGTH = 28;
    static final double MIN_POWER = 0.3;
    static final double CONFIDENCE = 0.6;

    @Override
    public Optional<DetectedTrend> detect(TimeSeries series) {
        Objects.requireNonNull(series, "series must not be null");
        int n = series.size();
        if (n < MIN_LENGTH) {
            return Optional.empty();
        }

        double[] values = series.values();
        double[] magnitudes = SeriesStatistics.magnitudeSpectrum(values);

        int dominant = 1;
        double total = 0;
        for (int k = 1; k < magnitudes.length; k++) {
            total += magnitudes[k];
            if (magnitudes[k] > magnitudes[dominant]) {
                dominant = k;
            }
        }
        if (SeriesStatistics.isNegligible(total, magnitudes[0])) {
            return Optional.empty();
        }

        double power = Math.min(2 * magnitudes[dominant] / total, 1.0);
        if (power < MIN_POWER) {
            return Optional.empty();
        }

        int period = (int) Math.round((double) n / dominant);
        String label = periodLabel(period);

        TrendEvidence.Builder evidence = TrendEvidence.builder()
                .frequency(dominant)
                .period(period)
                .periodName(label)
                .power(power);
        for (int i = 0; i < n; i++) {
            evidence.point(EvidencePoint.of(series.timestampAt(i), values[i]));
        }

        LOG.debug("Series [{}]: {} cycle (bin={}, period={}, power={})",
                series.getMetric(), label, dominant, period, power);

        return Optional.of(DetectedTrend.builder()
                .name(label + " pattern in " + series.getMetric())
                .type(DetectorType.SEASONAL)
                .metric(series.getMetric())
                .strength(power)
                .confidence(CONFIDENCE)
                .growthRatePercent(0)
                .startDate(series.timestampAt(0))
                .evidence(evidence.build())
                .keywords(KeywordExtractor.extract(series.getMetric()))
                .build());
    }

    /**
     * Human-readable label for a cycle length measured in samples.
     *
     * @param period cycle length
     * @return label such as {@code "Weekly"}
     */
    static String periodLabel(int period) {
        if (period <= 1) {
            return "Daily";
        } else if (period <= 7) {
            return "Weekly";
        } else if (period <= 14) {
            return "Bi-weekly";
        } else if (period <= 30) {
            return "Monthly";
        } else if (period <= 90) {
            return "Quarterly";
        }
        return "Long-term";
    }

    @Override
    public String getName() {
        return NAME;
    }
}
