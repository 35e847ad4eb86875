package com.trendsentinel.core.detection;

import com.trendsentinel.core.model.DetectedTrend;
import com.trendsentinel.core.model.DetectorType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static com.trendsentinel.core.detection.SeriesFixtures.DAY_ZERO;
import static com.trendsentinel.core.detection.SeriesFixtures.constant;
import static com.trendsentinel.core.detection.SeriesFixtures.daily;
import static com.trendsentinel.core.detection.SeriesFixtures.step;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link ChangePointDetector}.
 */
class ChangePointDetectorTest {

    private final ChangePointDetector detector = new ChangePointDetector();

    @Test
    @DisplayName("Should locate the level shift of a step series")
    void shouldDetectStep() {
        Optional<DetectedTrend> result = detector.detect(daily("app_crash_reports", step(11, 1, 10, 10)));

        assertThat(result).isPresent();
        DetectedTrend trend = result.get();
        assertThat(trend.getType()).isEqualTo(DetectorType.CHANGE_POINT);
        assertThat(trend.getName()).isEqualTo("Significant change detected in app_crash_reports");
        assertThat(trend.getStartDate()).isEqualTo(DAY_ZERO.plusSeconds(10 * 86_400L));
        assertThat(trend.getEvidence().getChangePoint()).isEqualTo(trend.getStartDate());
        assertThat(trend.getGrowthRatePercent()).isCloseTo(900.0, within(1e-9));
        assertThat(trend.getStrength()).isEqualTo(1.0);
        assertThat(trend.getConfidence()).isEqualTo(0.65);
        assertThat(trend.getEvidence().getTimeSeries()).hasSize(20);
    }

    @Test
    @DisplayName("Should NOT report a change for a gently rising series")
    void shouldIgnoreMonotoneSeriesWithoutStep() {
        double[] values = new double[30];
        for (int i = 0; i < values.length; i++) {
            values[i] = 100 + 0.1 * i;
        }

        assertThat(detector.detect(daily("page_views", values))).isEmpty();
    }

    @Test
    @DisplayName("Should NOT report a shift within the first 10 points")
    void shouldIgnoreEarlyShift() {
        assertThat(detector.detect(daily("page_views", step(5, 1, 20, 10)))).isEmpty();
    }

    @Test
    @DisplayName("Should NOT run on fewer than 20 points")
    void shouldRequireMinimumLength() {
        assertThat(detector.detect(daily("page_views", step(10, 1, 9, 10)))).isEmpty();
    }

    @Test
    @DisplayName("Should discard the candidate for a zero-mean series")
    void shouldGuardZeroMean() {
        assertThat(detector.detect(daily("page_views", constant(25, 0)))).isEmpty();
    }
}
