package com.trendsentinel.job;

import com.trendsentinel.core.alert.AlertEvaluator;
import com.trendsentinel.core.alert.AlertNotifier;
import com.trendsentinel.core.classification.TrendClassifier;
import com.trendsentinel.core.config.EngineConfig;
import com.trendsentinel.core.model.DataSource;
import com.trendsentinel.core.model.DetectedTrend;
import com.trendsentinel.core.model.DetectorType;
import com.trendsentinel.core.model.Observation;
import com.trendsentinel.core.model.TimeSeries;
import com.trendsentinel.core.model.Trend;
import com.trendsentinel.core.series.SeriesBuilder;
import com.trendsentinel.core.store.EventSource;
import com.trendsentinel.core.store.TrendStore;
import com.trendsentinel.core.store.TrendSummarizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Batch runtime that drives the detection core.
 *
 * <h3>Pipeline (per run)</h3>
 *
 * <pre>
 *   EventSource.listMetrics(dataSource)
 *     → fetchEvents(metric, window)       (failures logged per metric)
 *     → SeriesBuilder                      (short series skipped)
 *     → TrendClassifier on the worker pool (time budget per series)
 *     → sort by metric, detector type
 *     → TrendStore.save → AlertEvaluator
 * </pre>
 *
 * <h3>Lifecycle</h3>
 * <p>
 * {@link #start()} creates the worker pool (and, when
 * {@code runIntervalSeconds > 0}, a scheduler that repeats
 * {@link #runOnce()}); {@link #stop()} shuts both down. An engine can be
 * started once; running it before {@code start()} or after {@code stop()}
 * throws {@link IllegalStateException}.
 * </p>
 *
 * <h3>Series budget</h3>
 * <p>
 * Each series gets {@code seriesTimeoutMs} from the moment its detector set
 * starts on a worker, so series queued behind a slow one still get their full
 * budget. A series that is not picked up within {@code seriesTimeoutMs} of
 * the run waiting for it is abandoned as well.
 * </p>
 *
 * @since 1.0.0
 */
public class TrendAnalysisEngine {

    private static final Logger LOG = LoggerFactory.getLogger(TrendAnalysisEngine.class);

    private enum State {
        NEW, RUNNING, STOPPED
    }

    private final EngineConfig config;
    private final EventSource source;
    private final TrendStore store;
    private final TrendSummarizer summarizer;
    private final Clock clock;
    private final SeriesBuilder seriesBuilder;
    private final TrendClassifier classifier;
    private final AlertEvaluator evaluator;
    private final CountDownLatch stopped = new CountDownLatch(1);

    private State state = State.NEW;
    private ExecutorService workers;
    private ScheduledExecutorService scheduler;

    public TrendAnalysisEngine(EngineConfig config, EventSource source, TrendStore store,
            AlertNotifier notifier, Clock clock) {
        this(config, source, store, notifier, null, clock);
    }

    /**
     * @param summarizer optional; when present every newly saved trend is
     *                   summarised into the log
     */
    public TrendAnalysisEngine(EngineConfig config, EventSource source, TrendStore store,
            AlertNotifier notifier, TrendSummarizer summarizer, Clock clock) {
        this(config, source, store, notifier, summarizer, null, clock);
    }

    /**
     * @param classifier replaces the classifier built from {@code config};
     *                   {@code null} builds it from the configured detectors
     */
    TrendAnalysisEngine(EngineConfig config, EventSource source, TrendStore store,
            AlertNotifier notifier, TrendSummarizer summarizer, TrendClassifier classifier, Clock clock) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.summarizer = summarizer;
        config.validate();
        this.seriesBuilder = config.createSeriesBuilder();
        this.classifier = classifier != null
                ? classifier
                : new TrendClassifier(config.createDetectors(), config.toSignificanceGate());
        this.evaluator = new AlertEvaluator(store, notifier, config.getNotifyMaxAttempts(),
                Duration.ofMillis(config.getNotifyRetryWaitMs()), clock);
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    public synchronized void start() {
        if (state != State.NEW) {
            throw new IllegalStateException("Engine cannot be started in state " + state);
        }
        workers = Executors.newFixedThreadPool(config.getParallelism(), namedThreads("trend-worker"));
        if (config.getRunIntervalSeconds() > 0) {
            scheduler = Executors.newSingleThreadScheduledExecutor(namedThreads("trend-scheduler"));
            scheduler.scheduleWithFixedDelay(this::runScheduled,
                    0, config.getRunIntervalSeconds(), TimeUnit.SECONDS);
        }
        state = State.RUNNING;
        LOG.info("Trend analysis engine started (parallelism={}, interval={}s)",
                config.getParallelism(), config.getRunIntervalSeconds());
    }

    public void stop() {
        synchronized (this) {
            if (state != State.RUNNING) {
                state = State.STOPPED;
                stopped.countDown();
                return;
            }
            state = State.STOPPED;
        }
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
        workers.shutdown();
        try {
            if (!workers.awaitTermination(config.getSeriesTimeoutMs(), TimeUnit.MILLISECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        stopped.countDown();
        LOG.info("Trend analysis engine stopped");
    }

    /**
     * Block until {@link #stop()} has completed.
     *
     * @throws InterruptedException if interrupted while waiting
     */
    public void awaitStop() throws InterruptedException {
        stopped.await();
    }

    public synchronized boolean isRunning() {
        return state == State.RUNNING;
    }

    // ---------------------------------------------------------------
    // Run
    // ---------------------------------------------------------------

    /**
     * Execute one full analysis pass over the configured window.
     *
     * @return what the pass analysed and produced
     * @throws IllegalStateException if the engine is not running
     */
    public AnalysisReport runOnce() {
        ExecutorService pool;
        synchronized (this) {
            if (state != State.RUNNING) {
                throw new IllegalStateException("Engine is not running (state " + state + ")");
            }
            pool = workers;
        }

        Instant end = clock.instant();
        Instant start = config.getTimeWindow().startBefore(end);
        long startedNanos = System.nanoTime();
        AnalysisReport.Builder report = AnalysisReport.builder().window(start, end);

        DataSource dataSource = config.resolveDataSource();
        List<String> metrics;
        try {
            metrics = source.listMetrics(dataSource);
        } catch (Exception e) {
            LOG.error("Failed to list metrics for data source [{}]", dataSource.getCode(), e);
            return report.elapsed(Duration.ofNanos(System.nanoTime() - startedNanos)).build();
        }
        report.metricsListed(metrics.size());
        LOG.info("Analysing {} metric(s) from [{}] over [{}, {})", metrics.size(), dataSource.getCode(), start, end);

        Map<SeriesTask, Future<List<Finding>>> pending = new LinkedHashMap<>();
        for (String metric : metrics) {
            TimeSeries series;
            try {
                List<Observation> observations = source.fetchEvents(metric, start, end);
                series = seriesBuilder.forMetric(metric).build(metric, observations, start, end);
            } catch (Exception e) {
                LOG.error("Failed to fetch events for metric [{}]", metric, e);
                report.failed();
                continue;
            }
            if (series.size() < config.getMinSampleSize()) {
                LOG.debug("Skipping [{}]: {} point(s) < minSampleSize {}",
                        metric, series.size(), config.getMinSampleSize());
                report.skipped();
                continue;
            }
            SeriesTask task = new SeriesTask(series);
            try {
                pending.put(task, pool.submit(task));
            } catch (RejectedExecutionException e) {
                LOG.warn("Analysis of [{}] rejected, engine is shutting down", metric);
                report.failed();
            }
        }

        List<Finding> findings = new ArrayList<>();
        long budgetNanos = TimeUnit.MILLISECONDS.toNanos(config.getSeriesTimeoutMs());
        for (Map.Entry<SeriesTask, Future<List<Finding>>> entry : pending.entrySet()) {
            SeriesTask task = entry.getKey();
            Future<List<Finding>> future = entry.getValue();
            try {
                if (!task.awaitStart(budgetNanos)) {
                    future.cancel(true);
                    LOG.warn("Analysis of [{}] not started within {} ms, cancelled",
                            task.metric(), config.getSeriesTimeoutMs());
                    report.failed();
                    continue;
                }
                long remaining = task.startedNanos + budgetNanos - System.nanoTime();
                findings.addAll(future.get(Math.max(remaining, 0), TimeUnit.NANOSECONDS));
                report.analysed();
            } catch (TimeoutException e) {
                future.cancel(true);
                LOG.warn("Analysis of [{}] exceeded {} ms, cancelled", task.metric(), config.getSeriesTimeoutMs());
                report.failed();
            } catch (ExecutionException e) {
                LOG.error("Analysis of [{}] failed", task.metric(), e.getCause());
                report.failed();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warn("Interrupted while waiting for [{}], abandoning run", task.metric());
                pending.values().forEach(f -> f.cancel(true));
                break;
            }
        }

        findings.sort(Comparator.comparing((Finding f) -> f.trend.getMetric())
                .thenComparing(f -> f.detectorType));

        for (Finding finding : findings) {
            Trend trend = finding.trend;
            try {
                String id = store.save(trend);
                report.trend(id, trend);
                summarize(id, trend);
                report.alerts(evaluator.evaluate(id, trend));
            } catch (Exception e) {
                LOG.error("Failed to store trend [{}]", trend.getTrendName(), e);
            }
        }

        AnalysisReport result = report.elapsed(Duration.ofNanos(System.nanoTime() - startedNanos)).build();
        LOG.info("Run finished: {}", result);
        return result;
    }

    private List<Finding> analyse(TimeSeries series) {
        List<Finding> findings = new ArrayList<>();
        for (DetectedTrend candidate : classifier.detectAll(series)) {
            classifier.classify(candidate)
                    .ifPresent(trend -> findings.add(new Finding(candidate.getType(), trend)));
        }
        return findings;
    }

    private void summarize(String id, Trend trend) {
        if (summarizer == null) {
            return;
        }
        try {
            LOG.info("Trend {} summary: {}", id, summarizer.summarize(trend));
        } catch (Exception e) {
            LOG.warn("Summarizer failed for trend {}: {}", id, e.getMessage());
        }
    }

    private void runScheduled() {
        try {
            runOnce();
        } catch (IllegalStateException e) {
            LOG.debug("Scheduled run skipped: {}", e.getMessage());
        } catch (Exception e) {
            LOG.error("Scheduled analysis run failed", e);
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    public TrendClassifier getClassifier() {
        return classifier;
    }

    /**
     * Detector run for one series, recording when a worker picked it up.
     */
    private final class SeriesTask implements Callable<List<Finding>> {
        private final TimeSeries series;
        private final CountDownLatch started = new CountDownLatch(1);
        private volatile long startedNanos;

        SeriesTask(TimeSeries series) {
            this.series = series;
        }

        @Override
        public List<Finding> call() {
            startedNanos = System.nanoTime();
            started.countDown();
            return analyse(series);
        }

        boolean awaitStart(long timeoutNanos) throws InterruptedException {
            return started.await(timeoutNanos, TimeUnit.NANOSECONDS);
        }

        String metric() {
            return series.getMetric();
        }
    }

    /**
     * A classified trend together with the detector that produced it.
     */
    private static final class Finding {
        private final DetectorType detectorType;
        private final Trend trend;

        Finding(DetectorType detectorType, Trend trend) {
            this.detectorType = detectorType;
            this.trend = trend;
        }
    }
}
