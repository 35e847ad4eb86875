package com.trendsentinel.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for the range checks in {@link DetectedTrend.Builder}.
 */
class DetectedTrendTest {

    @Test
    @DisplayName("Should reject a non-finite growth rate")
    void shouldRejectNonFiniteGrowth() {
        DetectedTrend.Builder builder = base().strength(0.5).confidence(0.5)
                .growthRatePercent(Double.POSITIVE_INFINITY);

        assertThatThrownBy(builder::build)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("growthRatePercent");
    }

    @Test
    @DisplayName("Should reject strength outside [0, 1]")
    void shouldRejectStrengthOutOfRange() {
        DetectedTrend.Builder builder = base().strength(Double.NaN).confidence(0.5).growthRatePercent(1);

        assertThatThrownBy(builder::build)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("strength");
    }

    private static DetectedTrend.Builder base() {
        return DetectedTrend.builder()
                .name("Growing trend in orders")
                .type(DetectorType.GROWTH)
                .metric("orders")
                .startDate(Instant.parse("2024-01-01T00:00:00Z"))
                .evidence(TrendEvidence.builder().build());
    }
}
