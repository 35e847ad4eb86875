/**
 * Domain model of the trend detection engine.
 *
 * <ul>
 * <li>{@link com.trendsentinel.core.model.TimeSeries}: bucketed input
 * series</li>
 * <li>{@link com.trendsentinel.core.model.DetectedTrend}: raw detector
 * candidate with its {@link com.trendsentinel.core.model.TrendEvidence}</li>
 * <li>{@link com.trendsentinel.core.model.Trend}: canonical persisted
 * record</li>
 * <li>{@link com.trendsentinel.core.model.AlertSubscription} and
 * {@link com.trendsentinel.core.model.AlertEvent}: alert rules and their
 * triggers</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.trendsentinel.core.model;
