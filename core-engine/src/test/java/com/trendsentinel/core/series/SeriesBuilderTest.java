package com.trendsentinel.core.series;

import com.trendsentinel.core.model.Observation;
import com.trendsentinel.core.model.TimeSeries;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link SeriesBuilder}.
 */
class SeriesBuilderTest {

    private static final Instant START = Instant.parse("2024-03-01T00:00:00Z");
    private static final Instant END = Instant.parse("2024-03-05T00:00:00Z");

    private final List<Observation> observations = List.of(
            new Observation(Instant.parse("2024-02-29T23:59:59Z"), 100),
            new Observation(Instant.parse("2024-03-01T08:00:00Z"), 2),
            new Observation(Instant.parse("2024-03-01T20:00:00Z"), 3),
            new Observation(Instant.parse("2024-03-03T01:00:00Z"), 5),
            new Observation(Instant.parse("2024-03-05T00:00:00Z"), 100));

    @Test
    @DisplayName("Daily counts should count observations per UTC day and omit empty days")
    void shouldCountPerDay() {
        TimeSeries series = SeriesBuilder.dailyCounts().build("signups", observations, START, END);

        assertThat(series.size()).isEqualTo(2);
        assertThat(series.timestampAt(0)).isEqualTo(START);
        assertThat(series.timestampAt(1)).isEqualTo(Instant.parse("2024-03-03T00:00:00Z"));
        assertThat(series.values()).containsExactly(2, 1);
    }

    @Test
    @DisplayName("Sum aggregation should add values and drop points outside the window")
    void shouldSumValues() {
        TimeSeries series = new SeriesBuilder(Bucket.DAY, Aggregation.SUM)
                .build("revenue", observations, START, END);

        assertThat(series.values()).containsExactly(5, 5);
    }

    @Test
    @DisplayName("Mean aggregation should average the values of each bucket")
    void shouldAverageValues() {
        TimeSeries series = new SeriesBuilder(Bucket.DAY, Aggregation.MEAN)
                .build("basket_size", observations, START, END);

        assertThat(series.values()).containsExactly(2.5, 5);
    }

    @Test
    @DisplayName("Derived metrics should override the configured aggregation, others should not")
    void forMetricShouldApplyDerivedAggregation() {
        SeriesBuilder counts = SeriesBuilder.dailyCounts();

        assertThat(counts.forMetric("positive_sentiment").getAggregation()).isEqualTo(Aggregation.MEAN);
        assertThat(counts.forMetric("inventory_additions").getAggregation()).isEqualTo(Aggregation.SUM);
        assertThat(counts.forMetric("positive_sentiment").getBucket()).isEqualTo(Bucket.DAY);
        assertThat(counts.forMetric("feedback_volume")).isSameAs(counts);
        assertThat(counts.forMetric("checkout_errors")).isSameAs(counts);
    }

    @Test
    @DisplayName("Weekly buckets should start on Monday")
    void weeklyBucketsStartOnMonday() {
        // 2024-03-06 is a Wednesday
        assertThat(Bucket.WEEK.truncate(Instant.parse("2024-03-06T15:00:00Z")))
                .isEqualTo(Instant.parse("2024-03-04T00:00:00Z"));
    }
}
