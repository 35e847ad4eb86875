package com.trendsentinel.core.detection;

import com.trendsentinel.core.model.DetectedTrend;
import com.trendsentinel.core.model.TimeSeries;

import java.util.Optional;

/**
 * Contract for all trend detectors.
 *
 * <p>
 * Implementations are <strong>stateless</strong>: {@link #detect(TimeSeries)}
 * depends only on its argument, performs no I/O and may be called
 * concurrently from several worker threads. The statistical detectors in this
 * package are one family of strategies; a model-backed detector can be plugged
 * in behind the same interface.
 * </p>
 *
 * @since 1.0.0
 */
public interface TrendDetector {

    /**
     * Analyse a series and report at most one candidate.
     *
     * @param series the series to analyse; must not be {@code null}
     * @return a candidate if the series shows this detector's pattern, empty
     *         otherwise (including when the series is too short)
     */
    Optional<DetectedTrend> detect(TimeSeries series);

    /**
     * Return the registry name of this detector, e.g. {@code change_point}.
     *
     * @return detector name
     */
    String getName();
}
