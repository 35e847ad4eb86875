package com.trendsentinel.core.classification;

import com.trendsentinel.core.detection.DetectorFactory;
import com.trendsentinel.core.detection.TrendDetector;
import com.trendsentinel.core.model.DetectedTrend;
import com.trendsentinel.core.model.DetectorType;
import com.trendsentinel.core.model.EvidencePoint;
import com.trendsentinel.core.model.TimePeriod;
import com.trendsentinel.core.model.TimeSeries;
import com.trendsentinel.core.model.Trend;
import com.trendsentinel.core.model.TrendType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs the detector set against a series, filters the raw candidates through
 * a {@link SignificanceGate} and canonicalises the survivors into
 * {@link Trend} records.
 *
 * <h3>Isolation</h3>
 * <p>
 * Each detector is invoked inside its own try/catch. A detector that throws
 * is logged and treated as having produced no candidate; the remaining
 * detectors still run.
 * </p>
 *
 * <h3>Canonicalisation</h3>
 * <ul>
 * <li>type: growth → increasing, decline → decreasing, change point and
 * anomaly → stable, seasonal → seasonal</li>
 * <li>currentValue / previousValue: last / first evidence value</li>
 * <li>changePercent: relative change between them, 0 when the previous value
 * is 0</li>
 * <li>timePeriod: from the evidence sample count</li>
 * <li>significance: the detector confidence</li>
 * </ul>
 *
 * <p>
 * The classifier holds no mutable state and is safe to share between
 * threads.
 * </p>
 *
 * @since 1.0.0
 */
public class TrendClassifier {

    private static final Logger LOG = LoggerFactory.getLogger(TrendClassifier.class);

    private final List<TrendDetector> detectors;
    private final SignificanceGate gate;

    public TrendClassifier(List<TrendDetector> detectors, SignificanceGate gate) {
        Objects.requireNonNull(detectors, "detectors must not be null");
        this.detectors = Collections.unmodifiableList(new ArrayList<>(detectors));
        this.gate = Objects.requireNonNull(gate, "gate must not be null");
    }

    /**
     * @return a classifier over the default detector set and gate
     */
    public static TrendClassifier withDefaults() {
        return new TrendClassifier(DetectorFactory.createDefault(), SignificanceGate.defaults());
    }

    // ---------------------------------------------------------------
    // Pipeline
    // ---------------------------------------------------------------

    /**
     * Run every detector against the series and collect the candidates in
     * detector order.
     *
     * @param series the series to analyse
     * @return raw candidates, possibly empty
     */
    public List<DetectedTrend> detectAll(TimeSeries series) {
        Objects.requireNonNull(series, "series must not be null");
        List<DetectedTrend> candidates = new ArrayList<>();
        for (TrendDetector detector : detectors) {
            try {
                detector.detect(series).ifPresent(candidates::add);
            } catch (Exception e) {
                LOG.error("Detector [{}] failed on series [{}]", detector.getName(), series.getMetric(), e);
            }
        }
        return candidates;
    }

    /**
     * Apply the significance gate and canonicalise a single candidate.
     *
     * @param candidate raw detector output
     * @return the canonical trend, or empty if the candidate is not significant
     */
    public Optional<Trend> classify(DetectedTrend candidate) {
        Objects.requireNonNull(candidate, "candidate must not be null");
        if (!gate.isSignificant(candidate)) {
            LOG.trace("Candidate [{}] below significance gate (growth={}%, strength={})",
                    candidate.getName(), candidate.getGrowthRatePercent(), candidate.getStrength());
            return Optional.empty();
        }
        return Optional.of(canonicalize(candidate));
    }

    /**
     * Full pipeline for one series: detect, gate and canonicalise.
     *
     * @param series the series to analyse
     * @return qualifying trends in detector order
     */
    public List<Trend> analyze(TimeSeries series) {
        List<Trend> trends = new ArrayList<>();
        for (DetectedTrend candidate : detectAll(series)) {
            classify(candidate).ifPresent(trends::add);
        }
        if (!trends.isEmpty()) {
            LOG.debug("Series [{}]: {} qualifying trend(s)", series.getMetric(), trends.size());
        }
        return trends;
    }

    // ---------------------------------------------------------------
    // Canonicalisation
    // ---------------------------------------------------------------

    static Trend canonicalize(DetectedTrend candidate) {
        List<EvidencePoint> points = candidate.getEvidence().getTimeSeries();
        double current = points.isEmpty() ? 0 : points.get(points.size() - 1).getValue();
        double previous = points.isEmpty() ? current : points.get(0).getValue();
        double changePercent = previous == 0 ? 0 : (current - previous) / previous * 100;

        return Trend.builder()
                .trendName(candidate.getName())
                .trendType(toTrendType(candidate.getType()))
                .metric(candidate.getMetric())
                .currentValue(current)
                .previousValue(previous)
                .changePercent(changePercent)
                .timePeriod(TimePeriod.forSampleCount(points.size()))
                .significance(candidate.getConfidence())
                .startDate(candidate.getStartDate())
                .keywords(candidate.getKeywords())
                .build();
    }

    static TrendType toTrendType(DetectorType type) {
        return switch (type) {
            case GROWTH -> TrendType.INCREASING;
            case DECLINE -> TrendType.DECREASING;
            case CHANGE_POINT, ANOMALY -> TrendType.STABLE;
            case SEASONAL -> TrendType.SEASONAL;
        };
    }

    public List<TrendDetector> getDetectors() {
        return detectors;
    }

    public SignificanceGate getGate() {
        return gate;
    }
}
