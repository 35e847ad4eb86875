package com.trendsentinel.job;

import com.trendsentinel.core.model.AlertEvent;
import com.trendsentinel.core.model.Trend;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of a single {@link TrendAnalysisEngine#runOnce()} call.
 *
 * <p>
 * {@link #getTrends()} maps the store id of every saved trend to the trend,
 * in the order the trends were saved (metric name, then detector order).
 * </p>
 *
 * @since 1.0.0
 */
public final class AnalysisReport {

    private final Instant windowStart;
    private final Instant windowEnd;
    private final int metricsListed;
    private final int seriesAnalysed;
    private final int seriesSkipped;
    private final int seriesFailed;
    private final Map<String, Trend> trends;
    private final List<AlertEvent> alerts;
    private final Duration elapsed;

    private AnalysisReport(Builder b) {
        this.windowStart = Objects.requireNonNull(b.windowStart, "windowStart must not be null");
        this.windowEnd = Objects.requireNonNull(b.windowEnd, "windowEnd must not be null");
        this.metricsListed = b.metricsListed;
        this.seriesAnalysed = b.seriesAnalysed;
        this.seriesSkipped = b.seriesSkipped;
        this.seriesFailed = b.seriesFailed;
        this.trends = Collections.unmodifiableMap(new LinkedHashMap<>(b.trends));
        this.alerts = Collections.unmodifiableList(new ArrayList<>(b.alerts));
        this.elapsed = b.elapsed != null ? b.elapsed : Duration.ZERO;
    }

    static Builder builder() {
        return new Builder();
    }

    static class Builder {
        private Instant windowStart;
        private Instant windowEnd;
        private int metricsListed;
        private int seriesAnalysed;
        private int seriesSkipped;
        private int seriesFailed;
        private final Map<String, Trend> trends = new LinkedHashMap<>();
        private final List<AlertEvent> alerts = new ArrayList<>();
        private Duration elapsed;

        Builder window(Instant start, Instant end) {
            this.windowStart = start;
            this.windowEnd = end;
            return this;
        }

        Builder metricsListed(int metricsListed) {
            this.metricsListed = metricsListed;
            return this;
        }

        Builder analysed() {
            this.seriesAnalysed++;
            return this;
        }

        Builder skipped() {
            this.seriesSkipped++;
            return this;
        }

        Builder failed() {
            this.seriesFailed++;
            return this;
        }

        Builder trend(String id, Trend trend) {
            this.trends.put(id, trend);
            return this;
        }

        Builder alerts(List<AlertEvent> events) {
            this.alerts.addAll(events);
            return this;
        }

        Builder elapsed(Duration elapsed) {
            this.elapsed = elapsed;
            return this;
        }

        AnalysisReport build() {
            return new AnalysisReport(this);
        }
    }

    public Instant getWindowStart() {
        return windowStart;
    }

    public Instant getWindowEnd() {
        return windowEnd;
    }

    public int getMetricsListed() {
        return metricsListed;
    }

    public int getSeriesAnalysed() {
        return seriesAnalysed;
    }

    public int getSeriesSkipped() {
        return seriesSkipped;
    }

    public int getSeriesFailed() {
        return seriesFailed;
    }

    public Map<String, Trend> getTrends() {
        return trends;
    }

    public List<AlertEvent> getAlerts() {
        return alerts;
    }

    public Duration getElapsed() {
        return elapsed;
    }

    @Override
    public String toString() {
        return "AnalysisReport{" +
                "window=[" + windowStart + ", " + windowEnd + ")" +
                ", metricsListed=" + metricsListed +
                ", seriesAnalysed=" + seriesAnalysed +
                ", seriesSkipped=" + seriesSkipped +
                ", seriesFailed=" + seriesFailed +
                ", trends=" + trends.size() +
                ", alerts=" + alerts.size() +
                ", elapsed=" + elapsed +
                '}';
    }
}
