package com.trendsentinel.core.config;

import com.trendsentinel.core.model.AlertSubscription;
import com.trendsentinel.core.model.DataSource;
import com.trendsentinel.core.series.Aggregation;
import com.trendsentinel.core.series.Bucket;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @Test
    @DisplayName("Should load engine config from classpath")
    void shouldLoadEngineFromClasspath() {
        EngineConfig config = ConfigLoader.engineFromClasspath("test-engine.yml");

        assertThat(config.resolveDataSource()).isEqualTo(DataSource.FEEDBACK);
        assertThat(config.getTimeWindow().getValue()).isEqualTo(30);
        assertThat(config.getMinSampleSize()).isEqualTo(21);
        assertThat(config.resolveBucket()).isEqualTo(Bucket.DAY);
        assertThat(config.resolveAggregation()).isEqualTo(Aggregation.SUM);
        assertThat(config.getDetectors()).containsExactly("change_point", "anomaly");
        assertThat(config.toSignificanceGate().getMinGrowthRatePercent()).isEqualTo(250.0);
        assertThat(config.toSignificanceGate().getMinAnomalyStrength()).isEqualTo(0.6);
        assertThat(config.getParallelism()).isEqualTo(2);
        assertThat(config.getNotifyMaxAttempts()).isEqualTo(2);
        // not set in the file
        assertThat(config.getRunIntervalSeconds()).isZero();
    }

    @Test
    @DisplayName("Automatic resolution should fall back to trend-engine.yml and keep defaults")
    void shouldResolveDefaultResource() {
        EngineConfig config = ConfigLoader.loadEngine();

        assertThat(config.getTimeWindow().getValue()).isEqualTo(14);
        assertThat(config.getMinSampleSize()).isEqualTo(50);
        assertThat(config.getDetectors()).hasSize(4);
    }

    @Test
    @DisplayName("Should report every invalid engine field at once")
    void shouldFailFastOnInvalidEngine() {
        assertThatThrownBy(() -> ConfigLoader.engineFromClasspath("invalid-engine.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("warehouse")
                .hasMessageContaining("timeWindow.value")
                .hasMessageContaining("minSampleSize")
                .hasMessageContaining("prophet")
                .hasMessageContaining("parallelism");
    }

    @Test
    @DisplayName("Should load engine config from a file")
    void shouldLoadEngineFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("engine.yml");
        Files.writeString(file, "dataSource: inventory\nminSampleSize: 10\n");

        EngineConfig config = ConfigLoader.engineFromFile(file.toString());

        assertThat(config.resolveDataSource()).isEqualTo(DataSource.INVENTORY);
        assertThat(config.getMinSampleSize()).isEqualTo(10);
    }

    @Test
    @DisplayName("Should throw when the file does not exist")
    void shouldThrowForMissingFile(@TempDir Path dir) {
        assertThatThrownBy(() -> ConfigLoader.engineFromFile(dir.resolve("missing.yml").toString()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should throw when classpath resource does not exist")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> ConfigLoader.engineFromClasspath("does-not-exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should load subscriptions with nested conditions")
    void shouldLoadSubscriptions() {
        SubscriptionsConfig config = ConfigLoader.subscriptionsFromClasspath("test-subscriptions.yml");

        assertThat(config.getSubscriptions()).hasSize(2);
        AlertSubscription strong = config.getSubscriptions().get(0);
        assertThat(strong.getId()).isEqualTo("strong");
        assertThat(strong.getThreshold()).isEqualTo(0.8);
        assertThat(strong.isActive()).isTrue();

        AlertSubscription growth = config.getSubscriptions().get(1);
        assertThat(growth.isActive()).isFalse();
        assertThat(growth.getConditions().getMinGrowthRate()).isEqualTo(150.0);
        assertThat(growth.getConditions().getKeywords()).containsExactly("checkout");
        assertThat(growth.getConditions().getTrendTypes()).containsExactly("increasing");
    }

    @Test
    @DisplayName("Should reject duplicate subscription ids")
    void shouldRejectDuplicateIds() {
        assertThatThrownBy(() -> ConfigLoader.subscriptionsFromClasspath("duplicate-subscriptions.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Duplicate subscription id");
    }
}
