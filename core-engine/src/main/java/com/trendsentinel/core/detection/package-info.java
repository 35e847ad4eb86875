/**
 * Statistical trend detectors.
 *
 * <p>
 * All detectors implement the
 * {@link com.trendsentinel.core.detection.TrendDetector} interface and are
 * instantiated via {@link com.trendsentinel.core.detection.DetectorFactory}.
 * Built-in detectors:
 * </p>
 * <ul>
 * <li>{@link com.trendsentinel.core.detection.MovingAverageDetector}: sustained
 * growth or decline of the smoothed series</li>
 * <li>{@link com.trendsentinel.core.detection.ChangePointDetector}: abrupt level
 * shift located with CUSUM</li>
 * <li>{@link com.trendsentinel.core.detection.SeasonalityDetector}: dominant
 * cycle in the DFT magnitude spectrum</li>
 * <li>{@link com.trendsentinel.core.detection.ZScoreAnomalyDetector}: recent
 * spikes beyond 2.5 σ</li>
 * </ul>
 *
 * <h3>Extending</h3>
 * <p>
 * To add a detector, implement {@code TrendDetector} and register its name in
 * {@code DetectorFactory.create()}. Detectors must stay stateless; they are
 * shared across worker threads.
 * </p>
 *
 * @since 1.0.0
 */
package com.trendsentinel.core.detection;
