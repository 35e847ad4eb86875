package com.trendsentinel.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link TimeSeries}.
 */
class TimeSeriesTest {

    private static final Instant T0 = Instant.parse("2024-05-01T00:00:00Z");

    @Test
    @DisplayName("Should build an evenly spaced series")
    void shouldBuildEvenlySpaced() {
        TimeSeries series = TimeSeries.evenlySpaced("orders", T0, Duration.ofDays(1), 3, 4, 5);

        assertThat(series.size()).isEqualTo(3);
        assertThat(series.timestampAt(2)).isEqualTo(T0.plus(Duration.ofDays(2)));
        assertThat(series.values()).containsExactly(3, 4, 5);
    }

    @Test
    @DisplayName("Should reject duplicate timestamps")
    void shouldRejectDuplicateTimestamps() {
        List<SeriesPoint> points = List.of(new SeriesPoint(T0, 1), new SeriesPoint(T0, 2));

        assertThatThrownBy(() -> new TimeSeries("orders", points))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("strictly increasing");
    }

    @Test
    @DisplayName("Should reject out-of-order timestamps")
    void shouldRejectOutOfOrderTimestamps() {
        List<SeriesPoint> points = List.of(
                new SeriesPoint(T0.plusSeconds(60), 1),
                new SeriesPoint(T0, 2));

        assertThatThrownBy(() -> new TimeSeries("orders", points))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
