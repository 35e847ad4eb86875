/**
 * Filtering and canonicalisation of raw detector output.
 *
 * <p>
 * {@link com.trendsentinel.core.classification.TrendClassifier} runs the
 * detector set and turns the candidates that pass the
 * {@link com.trendsentinel.core.classification.SignificanceGate} into
 * persisted {@link com.trendsentinel.core.model.Trend} records.
 * </p>
 *
 * @since 1.0.0
 */
package com.trendsentinel.core.classification;
