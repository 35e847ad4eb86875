package com.trendsentinel.job;

import com.trendsentinel.core.config.ConfigLoader;
import com.trendsentinel.core.config.EngineConfig;
import com.trendsentinel.core.config.SubscriptionsConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Command-line entry point for the trend analysis job.
 *
 * <h3>Configuration</h3>
 * <p>
 * File locations come from environment variables via {@link JobConfig};
 * engine tuning comes from the YAML loaded by {@link ConfigLoader}.
 * </p>
 *
 * <h3>Modes</h3>
 * <p>
 * With {@code runIntervalSeconds: 0} the job runs a single pass and exits.
 * Otherwise it keeps running passes until the JVM receives a shutdown
 * signal.
 * </p>
 *
 * @since 1.0.0
 */
public final class TrendAnalysisJob {

    private static final Logger LOG = LoggerFactory.getLogger(TrendAnalysisJob.class);

    private TrendAnalysisJob() {
        // entry-point class, not instantiable
    }

    public static void main(String[] args) throws Exception {
        // 1. Load configuration
        JobConfig jobConfig = JobConfig.fromEnvironment();
        LOG.info("Starting Trend Sentinel with config: {}", jobConfig);
        EngineConfig engineConfig = ConfigLoader.loadEngine();

        // 2. Wire collaborators
        InMemoryTrendStore store = new InMemoryTrendStore();
        if (jobConfig.hasSubscriptionsPath()) {
            SubscriptionsConfig subscriptions = ConfigLoader.subscriptionsFromFile(jobConfig.getSubscriptionsPath());
            store.addSubscriptions(subscriptions.getSubscriptions());
        } else {
            LOG.warn("No {} set, running without alert subscriptions", JobConfig.ENV_SUBSCRIPTIONS_PATH);
        }
        JsonLinesEventSource source = new JsonLinesEventSource(Path.of(jobConfig.getEventsFile()));
        LoggingAlertNotifier notifier = new LoggingAlertNotifier(new AlertEventSerializer());

        TrendAnalysisEngine engine = new TrendAnalysisEngine(
                engineConfig, source, store, notifier, Clock.systemUTC());

        // 3. Run
        engine.start();
        if (engineConfig.getRunIntervalSeconds() == 0) {
            try {
                AnalysisReport report = engine.runOnce();
                LOG.info("Analysis complete: {} trend(s), {} alert(s)",
                        report.getTrends().size(), report.getAlerts().size());
            } finally {
                engine.stop();
            }
        } else {
            Runtime.getRuntime().addShutdownHook(new Thread(engine::stop, "engine-shutdown"));
            engine.awaitStop();
        }
    }
}
