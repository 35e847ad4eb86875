/**
 * Turning raw observations into analysable series.
 *
 * <p>
 * {@link com.trendsentinel.core.series.SeriesDeriver} turns raw family
 * events into metric observations,
 * {@link com.trendsentinel.core.series.SeriesBuilder} buckets observations,
 * {@link com.trendsentinel.core.series.TimeWindow} resolves the look-back span
 * and {@link com.trendsentinel.core.series.KeywordExtractor} derives keywords
 * from metric labels.
 * </p>
 *
 * @since 1.0.0
 */
package com.trendsentinel.core.series;
