package com.trendsentinel.job;

import com.trendsentinel.core.model.DataSource;
import com.trendsentinel.core.model.Observation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JsonLinesEventSource}.
 */
class JsonLinesEventSourceTest {

    @TempDir
    Path dir;

    private JsonLinesEventSource source;

    @BeforeEach
    void setUp() throws IOException {
        Path file = dir.resolve("events.jsonl");
        Files.write(file, List.of(
                "{\"source\":\"feedback\",\"metric\":\"checkout_errors\",\"timestamp\":\"2024-03-01T10:00:00Z\"}",
                "{\"source\":\"feedback\",\"metric\":\"checkout_errors\",\"timestamp\":\"2024-03-02T10:00:00Z\",\"value\":4}",
                "",
                "not json at all",
                "{\"source\":\"analytics\",\"metric\":\"page_views\",\"timestamp\":\"2024-03-01T10:00:00Z\",\"value\":120,\"browser\":\"firefox\"}",
                "{\"source\":\"warehouse\",\"metric\":\"pallets\",\"timestamp\":\"2024-03-01T10:00:00Z\"}",
                "{\"source\":\"inventory\",\"timestamp\":\"2024-03-01T10:00:00Z\"}",
                "{\"source\":\"feedback\",\"metric\":\"checkout_errors\",\"timestamp\":\"2024-04-01T00:00:00Z\"}"));
        source = new JsonLinesEventSource(file);
    }

    @Test
    @DisplayName("Should list metrics per family, skipping malformed and unknown rows")
    void shouldListMetrics() throws IOException {
        assertThat(source.listMetrics(DataSource.ALL)).containsExactly("checkout_errors", "page_views");
        assertThat(source.listMetrics(DataSource.FEEDBACK)).containsExactly("checkout_errors");
        assertThat(source.listMetrics(DataSource.RECIPES)).isEmpty();
    }

    @Test
    @DisplayName("Should fetch a metric's events inside [start, end) with default value 1")
    void shouldFetchEventsInWindow() throws IOException {
        List<Observation> observations = source.fetchEvents("checkout_errors",
                Instant.parse("2024-03-01T00:00:00Z"), Instant.parse("2024-04-01T00:00:00Z"));

        assertThat(observations).extracting(Observation::getValue).containsExactly(1.0, 4.0);
    }

    @Test
    @DisplayName("Rows without a metric should feed the series derived for their family")
    void shouldDeriveSeriesFromRawRows() throws IOException {
        Path file = dir.resolve("raw.jsonl");
        Files.write(file, List.of(
                "{\"source\":\"feedback\",\"sentiment\":\"positive\",\"timestamp\":\"2024-03-01T10:00:00Z\"}",
                "{\"source\":\"feedback\",\"sentiment\":\"negative\",\"timestamp\":\"2024-03-01T11:00:00Z\"}",
                "{\"source\":\"inventory\",\"type\":\"item_removed\",\"timestamp\":\"2024-03-01T12:00:00Z\"}",
                "{\"source\":\"all\",\"type\":\"item_removed\",\"timestamp\":\"2024-03-01T12:00:00Z\"}"));
        JsonLinesEventSource raw = new JsonLinesEventSource(file);

        assertThat(raw.listMetrics(DataSource.ALL)).containsExactly(
                "feedback_volume", "inventory_additions", "inventory_turnover", "positive_sentiment");
        assertThat(raw.listMetrics(DataSource.INVENTORY)).containsExactly("inventory_additions", "inventory_turnover");
        assertThat(raw.fetchEvents("positive_sentiment",
                        Instant.parse("2024-03-01T00:00:00Z"), Instant.parse("2024-03-02T00:00:00Z")))
                .extracting(Observation::getValue)
                .containsExactly(1.0, 0.0);
    }

    @Test
    @DisplayName("Should propagate a missing file as IOException")
    void shouldFailForMissingFile() {
        JsonLinesEventSource missing = new JsonLinesEventSource(dir.resolve("nope.jsonl"));

        assertThatThrownBy(() -> missing.listMetrics(DataSource.ALL))
                .isInstanceOf(NoSuchFileException.class);
    }
}
