/**
 * Batch runtime for the trend detection core.
 *
 * <p>
 * {@link com.trendsentinel.job.TrendAnalysisJob} wires a JSON-lines
 * {@link com.trendsentinel.job.JsonLinesEventSource}, an
 * {@link com.trendsentinel.job.InMemoryTrendStore} and a
 * {@link com.trendsentinel.job.LoggingAlertNotifier} into a
 * {@link com.trendsentinel.job.TrendAnalysisEngine}.
 * </p>
 *
 * @since 1.0.0
 */
package com.trendsentinel.job;
