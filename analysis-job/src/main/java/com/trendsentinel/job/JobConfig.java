package com.trendsentinel.job;

import java.io.Serializable;

/**
 * Typed, immutable configuration for the trend analysis job.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so
 * the job can be configured through a container's env block or a shell
 * environment. Engine tuning (window, thresholds, parallelism) lives in the
 * YAML resolved by {@link com.trendsentinel.core.config.ConfigLoader#loadEngine()},
 * whose location is overridden through
 * {@value com.trendsentinel.core.config.ConfigLoader#ENV_CONFIG_PATH}.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder} for
 * programmatic / test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class JobConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String ENV_EVENTS_FILE = "EVENTS_FILE";
    public static final String ENV_SUBSCRIPTIONS_PATH = "SUBSCRIPTIONS_PATH";

    /** JSON-lines file holding the raw events. */
    private final String eventsFile;

    /** Subscriptions YAML; blank runs without alert subscriptions. */
    private final String subscriptionsPath;

    private JobConfig(Builder b) {
        this.eventsFile = b.eventsFile;
        this.subscriptionsPath = b.subscriptionsPath;
    }

    /**
     * Build a {@link JobConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalArgumentException if a value is invalid
     */
    public static JobConfig fromEnvironment() {
        return new Builder()
                .eventsFile(env(ENV_EVENTS_FILE, "events.jsonl"))
                .subscriptionsPath(env(ENV_SUBSCRIPTIONS_PATH, ""))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getEventsFile() {
        return eventsFile;
    }

    public String getSubscriptionsPath() {
        return subscriptionsPath;
    }

    public boolean hasSubscriptionsPath() {
        return !subscriptionsPath.isBlank();
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link JobConfig}.
     */
    public static class Builder {
        private String eventsFile = "events.jsonl";
        private String subscriptionsPath = "";

        public Builder eventsFile(String v) {
            this.eventsFile = v;
            return this;
        }

        public Builder subscriptionsPath(String v) {
            this.subscriptionsPath = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link JobConfig}
         * @throws IllegalArgumentException if the events file is blank
         */
        public JobConfig build() {
            if (eventsFile == null || eventsFile.isBlank()) {
                throw new IllegalArgumentException("eventsFile must not be null or blank");
            }
            subscriptionsPath = subscriptionsPath == null ? "" : subscriptionsPath.trim();
            return new JobConfig(this);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    @Override
    public String toString() {
        return "JobConfig{" +
                "eventsFile='" + eventsFile + '\'' +
                ", subscriptionsPath='" + subscriptionsPath + '\'' +
                '}';
    }
}
