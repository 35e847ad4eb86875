package com.trendsentinel.job;

import com.trendsentinel.core.classification.SignificanceGate;
import com.trendsentinel.core.classification.TrendClassifier;
import com.trendsentinel.core.config.EngineConfig;
import com.trendsentinel.core.detection.DetectorFactory;
import com.trendsentinel.core.detection.TrendDetector;
import com.trendsentinel.core.model.AlertEvent;
import com.trendsentinel.core.model.AlertSubscription;
import com.trendsentinel.core.model.DataSource;
import com.trendsentinel.core.model.DetectedTrend;
import com.trendsentinel.core.model.Observation;
import com.trendsentinel.core.model.TimeSeries;
import com.trendsentinel.core.model.Trend;
import com.trendsentinel.core.model.TrendType;
import com.trendsentinel.core.series.TimeWindow;
import com.trendsentinel.core.store.EventSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end tests for {@link TrendAnalysisEngine}: events in, stored trends
 * and alerts out.
 */
class TrendAnalysisEngineTest {

    private static final Instant FIRST_DAY = Instant.parse("2024-03-01T00:00:00Z");
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-25T00:00:00Z"), ZoneOffset.UTC);

    /** Baseline 10, 11, 9, 12 then a jump to 50, 52, 55, 53. */
    private static final double[] JUMP = {
            10, 11, 9, 12, 10, 11, 9, 12, 10, 11, 9, 12, 10, 11, 9, 12,
            50, 52, 55, 53, 50, 52, 55, 53 };

    private StubEventSource source;
    private InMemoryTrendStore store;
    private List<AlertEvent> delivered;
    private TrendAnalysisEngine engine;

    @BeforeEach
    void setUp() {
        source = new StubEventSource();
        store = new InMemoryTrendStore(CLOCK);
        delivered = new ArrayList<>();

        engine = new TrendAnalysisEngine(config(2, 30_000), source, store, delivered::add, CLOCK);
    }

    @AfterEach
    void tearDown() {
        engine.stop();
    }

    @Test
    @DisplayName("A jump in daily counts should persist a stable trend with > 300% change")
    void jumpShouldPersistStableTrend() {
        source.add("checkout_errors", DataSource.FEEDBACK, JUMP);
        engine.start();

        AnalysisReport report = engine.runOnce();

        assertThat(report.getSeriesAnalysed()).isEqualTo(1);
        assertThat(report.getTrends().values())
                .extracting(Trend::getTrendType)
                .containsExactly(TrendType.INCREASING, TrendType.STABLE);

        Trend stable = report.getTrends().values().stream()
                .filter(t -> t.getTrendType() == TrendType.STABLE)
                .findFirst()
                .orElseThrow();
        assertThat(stable.getTrendName()).isEqualTo("Significant change detected in checkout_errors");
        assertThat(stable.getChangePercent()).isGreaterThan(300);
        assertThat(stable.getSignificance()).isEqualTo(0.65);
        assertThat(stable.getStartDate()).isEqualTo(FIRST_DAY.plus(Duration.ofDays(15)));
        assertThat(store.getTrends()).hasSize(2);
    }

    @Test
    @DisplayName("Matching subscriptions should trigger, be recorded and be delivered")
    void shouldTriggerAlerts() {
        source.add("checkout_errors", DataSource.FEEDBACK, JUMP);
        store.addSubscriptions(List.of(
                threshold("loose", 0.6, true),
                threshold("strict", 0.8, true),
                threshold("muted", 0.1, false)));
        engine.start();

        AnalysisReport report = engine.runOnce();

        assertThat(report.getAlerts()).extracting(AlertEvent::getSubscriptionId)
                .containsExactly("loose", "loose");
        assertThat(delivered).hasSize(2);
        assertThat(store.getTriggers()).hasSize(2);
        assertThat(delivered.get(1).getMessage()).startsWith("Trend Alert: Significant change detected in checkout_errors");
    }

    @Test
    @DisplayName("Short series should be skipped and fetch failures should not abort the run")
    void shouldSkipShortSeriesAndIsolateFailures() {
        source.add("checkout_errors", DataSource.FEEDBACK, JUMP);
        source.add("new_feature_clicks", DataSource.ANALYTICS, 1, 2, 3);
        source.failing.add("broken_metric");
        engine.start();

        AnalysisReport report = engine.runOnce();

        assertThat(report.getMetricsListed()).isEqualTo(3);
        assertThat(report.getSeriesAnalysed()).isEqualTo(1);
        assertThat(report.getSeriesSkipped()).isEqualTo(1);
        assertThat(report.getSeriesFailed()).isEqualTo(1);
        assertThat(report.getTrends()).isNotEmpty();
    }

    @Test
    @DisplayName("Results should be ordered by metric name")
    void resultsShouldBeSortedByMetric() {
        source.add("zucchini_searches", DataSource.RECIPES, JUMP);
        source.add("avocado_searches", DataSource.RECIPES, JUMP);
        engine.start();

        AnalysisReport report = engine.runOnce();

        assertThat(report.getTrends().values()).extracting(Trend::getMetric)
                .containsExactly("avocado_searches", "avocado_searches", "zucchini_searches", "zucchini_searches");
    }

    @Test
    @DisplayName("A second run should reuse the stored trend ids")
    void secondRunShouldDeduplicate() {
        source.add("checkout_errors", DataSource.FEEDBACK, JUMP);
        engine.start();

        AnalysisReport first = engine.runOnce();
        AnalysisReport second = engine.runOnce();

        assertThat(second.getTrends().keySet()).isEqualTo(first.getTrends().keySet());
        assertThat(store.getTrends()).hasSize(2);
    }

    @Test
    @DisplayName("A series over its budget should be cancelled without starving the series queued behind it")
    void slowSeriesShouldTimeOutWithoutStarvingOthers() {
        engine = engineBlocking(config(1, 500), Set.of("a_slow"));
        source.add("a_slow", DataSource.FEEDBACK, JUMP);
        source.add("b_fast", DataSource.FEEDBACK, JUMP);
        engine.start();

        AnalysisReport report = engine.runOnce();

        assertThat(report.getSeriesFailed()).isEqualTo(1);
        assertThat(report.getSeriesAnalysed()).isEqualTo(1);
        assertThat(report.getTrends().values()).extracting(Trend::getMetric)
                .containsOnly("b_fast");
    }

    @Test
    @DisplayName("Series running side by side should share one budget window instead of stacking up")
    void parallelTimeoutsShouldNotAccumulate() {
        engine = engineBlocking(config(3, 600), Set.of("a_slow", "b_slow", "c_slow"));
        source.add("a_slow", DataSource.FEEDBACK, JUMP);
        source.add("b_slow", DataSource.FEEDBACK, JUMP);
        source.add("c_slow", DataSource.FEEDBACK, JUMP);
        engine.start();

        AnalysisReport report = engine.runOnce();

        assertThat(report.getSeriesFailed()).isEqualTo(3);
        assertThat(report.getTrends()).isEmpty();
        assertThat(report.getElapsed()).isLessThan(Duration.ofMillis(1_500));
    }

    @Test
    @DisplayName("A submission rejected by a stopping engine should count as failed, not abort the run")
    void rejectedSubmissionShouldCountAsFailed() {
        source.add("a_metric", DataSource.FEEDBACK, JUMP);
        source.add("b_metric", DataSource.FEEDBACK, JUMP);
        source.beforeFetch.put("b_metric", () -> engine.stop());
        engine.start();

        AnalysisReport report = engine.runOnce();

        assertThat(report.getSeriesAnalysed()).isEqualTo(1);
        assertThat(report.getSeriesFailed()).isEqualTo(1);
        assertThat(report.getTrends().values()).extracting(Trend::getMetric)
                .containsOnly("a_metric");
    }

    @Test
    @DisplayName("Running before start or after stop should be rejected")
    void shouldEnforceLifecycle() {
        assertThatThrownBy(engine::runOnce).isInstanceOf(IllegalStateException.class);

        engine.start();
        assertThat(engine.isRunning()).isTrue();
        assertThatThrownBy(engine::start).isInstanceOf(IllegalStateException.class);

        engine.stop();
        assertThatThrownBy(engine::runOnce).isInstanceOf(IllegalStateException.class);
    }

    // ---------------------------------------------------------------
    // Fixtures
    // ---------------------------------------------------------------

    private static EngineConfig config(int parallelism, long seriesTimeoutMs) {
        EngineConfig config = new EngineConfig();
        config.setTimeWindow(new TimeWindow(30, "days"));
        config.setMinSampleSize(20);
        config.setAggregation("sum");
        config.setParallelism(parallelism);
        config.setSeriesTimeoutMs(seriesTimeoutMs);
        config.setNotifyRetryWaitMs(1);
        return config;
    }

    private TrendAnalysisEngine engineBlocking(EngineConfig config, Set<String> blocked) {
        List<TrendDetector> detectors = new ArrayList<>();
        detectors.add(new BlockingDetector(blocked));
        detectors.addAll(DetectorFactory.createDefault());
        TrendClassifier classifier = new TrendClassifier(detectors, SignificanceGate.defaults());
        return new TrendAnalysisEngine(config, source, store, delivered::add, null, classifier, CLOCK);
    }

    private static AlertSubscription threshold(String id, double threshold, boolean active) {
        AlertSubscription subscription = new AlertSubscription();
        subscription.setId(id);
        subscription.setOwnerId("owner-1");
        subscription.setAlertType("threshold");
        subscription.setThreshold(threshold);
        subscription.setActive(active);
        return subscription;
    }

    /** Sleeps on the listed metrics until interrupted by cancellation. */
    private static final class BlockingDetector implements TrendDetector {
        private final Set<String> blocked;

        BlockingDetector(Set<String> blocked) {
            this.blocked = blocked;
        }

        @Override
        public Optional<DetectedTrend> detect(TimeSeries series) {
            if (blocked.contains(series.getMetric())) {
                try {
                    Thread.sleep(60_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return Optional.empty();
        }

        @Override
        public String getName() {
            return "blocking";
        }
    }

    /** One observation per day at noon, carrying the daily value. */
    private static final class StubEventSource implements EventSource {
        private final Map<String, DataSource> families = new LinkedHashMap<>();
        private final Map<String, List<Observation>> events = new LinkedHashMap<>();
        private final Map<String, Runnable> beforeFetch = new LinkedHashMap<>();
        private final List<String> failing = new ArrayList<>();

        void add(String metric, DataSource family, double... daily) {
            List<Observation> observations = new ArrayList<>();
            for (int i = 0; i < daily.length; i++) {
                observations.add(new Observation(FIRST_DAY.plus(Duration.ofDays(i)).plus(Duration.ofHours(12)), daily[i]));
            }
            families.put(metric, family);
            events.put(metric, observations);
        }

        @Override
        public List<String> listMetrics(DataSource dataSource) {
            List<String> metrics = new ArrayList<>();
            families.forEach((metric, family) -> {
                if (dataSource.includes(family)) {
                    metrics.add(metric);
                }
            });
            metrics.addAll(failing);
            return metrics;
        }

        @Override
        public List<Observation> fetchEvents(String sourceId, Instant start, Instant end) throws IOException {
            if (failing.contains(sourceId)) {
                throw new IOException("connection reset");
            }
            Runnable hook = beforeFetch.get(sourceId);
            if (hook != null) {
                hook.run();
            }
            return events.getOrDefault(sourceId, List.of());
        }
    }
}
