package com.trendsentinel.core.store;

import com.trendsentinel.core.model.Trend;

/**
 * Optional enrichment hook that turns a stored trend into a human-readable
 * narrative. The detection core never calls it; runtimes may.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface TrendSummarizer {

    String summarize(Trend trend);
}
