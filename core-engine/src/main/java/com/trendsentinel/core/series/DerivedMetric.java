package com.trendsentinel.core.series;

import com.trendsentinel.core.model.DataSource;

import java.util.Optional;

/**
 * Fixed metrics derived from raw family events by {@link SeriesDeriver}.
 *
 * <p>
 * Each derived metric fixes the aggregation that turns its observations into
 * a series. Analytics metrics are named after their event type and are not
 * listed here.
 * </p>
 *
 * @since 1.0.0
 */
public enum DerivedMetric {

    FEEDBACK_VOLUME("feedback_volume", DataSource.FEEDBACK, Aggregation.COUNT),
    POSITIVE_SENTIMENT("positive_sentiment", DataSource.FEEDBACK, Aggregation.MEAN),
    INVENTORY_ADDITIONS("inventory_additions", DataSource.INVENTORY, Aggregation.SUM),
    INVENTORY_TURNOVER("inventory_turnover", DataSource.INVENTORY, Aggregation.SUM),
    RECIPE_VIEWS("recipe_views", DataSource.RECIPES, Aggregation.SUM),
    RECIPE_CREATION("recipe_creation", DataSource.RECIPES, Aggregation.SUM);

    private final String metricName;
    private final DataSource source;
    private final Aggregation aggregation;

    DerivedMetric(String metricName, DataSource source, Aggregation aggregation) {
        this.metricName = metricName;
        this.source = source;
        this.aggregation = aggregation;
    }

    public String getMetricName() {
        return metricName;
    }

    public DataSource getSource() {
        return source;
    }

    public Aggregation getAggregation() {
        return aggregation;
    }

    /**
     * @param metricName metric label, compared exactly
     * @return the derived metric with that name, or empty for any other metric
     */
    public static Optional<DerivedMetric> fromName(String metricName) {
        for (DerivedMetric metric : values()) {
            if (metric.metricName.equals(metricName)) {
                return Optional.of(metric);
            }
        }
        return Optional.empty();
    }
}
