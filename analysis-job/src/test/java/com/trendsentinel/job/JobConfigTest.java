package com.trendsentinel.job;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JobConfig.Builder}.
 */
class JobConfigTest {

    @Test
    @DisplayName("Builder defaults should point at events.jsonl without optional files")
    void shouldApplyDefaults() {
        JobConfig config = JobConfig.builder().build();

        assertThat(config.getEventsFile()).isEqualTo("events.jsonl");
        assertThat(config.hasSubscriptionsPath()).isFalse();
    }

    @Test
    @DisplayName("Should trim optional paths and reject a blank events file")
    void shouldValidate() {
        JobConfig config = JobConfig.builder().subscriptionsPath("  subs.yml ").build();

        assertThat(config.getSubscriptionsPath()).isEqualTo("subs.yml");
        assertThatThrownBy(() -> JobConfig.builder().eventsFile(" ").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("eventsFile");
    }

    @Test
    @DisplayName("Only the events file and subscriptions should be job settings")
    void shouldLeaveEngineConfigToTheLoader() {
        JobConfig config = JobConfig.builder()
                .eventsFile("/data/events.jsonl")
                .subscriptionsPath("subs.yml")
                .build();

        assertThat(config).hasToString(
                "JobConfig{eventsFile='/data/events.jsonl', subscriptionsPath='subs.yml'}");
    }
}
