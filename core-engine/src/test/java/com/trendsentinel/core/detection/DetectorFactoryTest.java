package com.trendsentinel.core.detection;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DetectorFactory}.
 */
class DetectorFactoryTest {

    @Test
    @DisplayName("Should create each built-in detector by name, ignoring case")
    void shouldCreateByName() {
        assertThat(DetectorFactory.create("moving_average")).isInstanceOf(MovingAverageDetector.class);
        assertThat(DetectorFactory.create("CHANGE_POINT")).isInstanceOf(ChangePointDetector.class);
        assertThat(DetectorFactory.create(" seasonality ")).isInstanceOf(SeasonalityDetector.class);
        assertThat(DetectorFactory.create("anomaly")).isInstanceOf(ZScoreAnomalyDetector.class);
    }

    @Test
    @DisplayName("Default set should run all four detectors in order")
    void defaultSetShouldBeOrdered() {
        List<TrendDetector> detectors = DetectorFactory.createDefault();

        assertThat(detectors).extracting(TrendDetector::getName)
                .containsExactly("moving_average", "change_point", "seasonality", "anomaly");
    }

    @Test
    @DisplayName("Should throw for unknown detector name")
    void shouldThrowForUnknownName() {
        assertThatThrownBy(() -> DetectorFactory.create("prophet"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown detector");
    }
}
