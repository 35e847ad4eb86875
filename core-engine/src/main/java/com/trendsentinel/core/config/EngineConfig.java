package com.trendsentinel.core.config;

import com.trendsentinel.core.classification.SignificanceGate;
import com.trendsentinel.core.detection.DetectorFactory;
import com.trendsentinel.core.detection.TrendDetector;
import com.trendsentinel.core.model.DataSource;
import com.trendsentinel.core.series.Aggregation;
import com.trendsentinel.core.series.Bucket;
import com.trendsentinel.core.series.SeriesBuilder;
import com.trendsentinel.core.series.TimeWindow;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Top-level POJO for the engine YAML configuration.
 *
 * <p>
 * Expected YAML structure (every key is optional):
 * </p>
 *
 * <pre>
 * dataSource: all
 * timeWindow:
 *   value: 90
 *   unit: days
 * minSampleSize: 50
 * bucket: day
 * aggregation: count
 * detectors: [moving_average, change_point, seasonality, anomaly]
 * minGrowthRatePercent: 300
 * minAnomalyStrength: 0.7
 * parallelism: 4
 * seriesTimeoutMs: 30000
 * notifyMaxAttempts: 3
 * notifyRetryWaitMs: 200
 * runIntervalSeconds: 0
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading; the typed {@code resolve*} /
 * {@code create*} accessors assume a valid configuration.
 * </p>
 *
 * @since 1.0.0
 */
public class EngineConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private String dataSource = "all";

    private TimeWindow timeWindow = new TimeWindow();

    /** Series shorter than this are not analysed. */
    private int minSampleSize = 50;

    private String bucket = "day";

    private String aggregation = "count";

    private List<String> detectors = new ArrayList<>(DetectorFactory.DEFAULT_DETECTORS);

    private double minGrowthRatePercent = SignificanceGate.DEFAULT_MIN_GROWTH_RATE_PERCENT;

    private double minAnomalyStrength = SignificanceGate.DEFAULT_MIN_ANOMALY_STRENGTH;

    /** Worker threads analysing series concurrently. */
    private int parallelism = 4;

    /** Upper bound on the wall-clock time spent on one series. */
    private long seriesTimeoutMs = 30_000;

    private int notifyMaxAttempts = 3;

    /** Pause between alert delivery attempts. */
    private long notifyRetryWaitMs = 200;

    /** Interval between scheduled runs; 0 runs once. */
    private long runIntervalSeconds = 0;

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate every field, collecting all problems into one exception.
     *
     * @throws IllegalStateException if the configuration is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        try {
            resolveDataSource();
        } catch (IllegalArgumentException e) {
            errors.add(e.getMessage());
        }
        if (timeWindow == null) {
            errors.add("'timeWindow' is required");
        } else {
            try {
                timeWindow.validate();
            } catch (IllegalStateException e) {
                errors.add(e.getMessage());
            }
        }
        if (minSampleSize < 1) {
            errors.add("'minSampleSize' must be >= 1, got: " + minSampleSize);
        }
        try {
            resolveBucket();
        } catch (IllegalArgumentException e) {
            errors.add(e.getMessage());
        }
        try {
            resolveAggregation();
        } catch (IllegalArgumentException e) {
            errors.add(e.getMessage());
        }
        if (detectors.isEmpty()) {
            errors.add("'detectors' must name at least one detector");
        }
        for (String name : detectors) {
            try {
                DetectorFactory.create(name);
            } catch (IllegalArgumentException | NullPointerException e) {
                errors.add(e.getMessage());
            }
        }
        try {
            toSignificanceGate();
        } catch (IllegalArgumentException e) {
            errors.add(e.getMessage());
        }
        if (parallelism < 1) {
            errors.add("'parallelism' must be >= 1, got: " + parallelism);
        }
        if (seriesTimeoutMs < 1) {
            errors.add("'seriesTimeoutMs' must be >= 1, got: " + seriesTimeoutMs);
        }
        if (notifyMaxAttempts < 1) {
            errors.add("'notifyMaxAttempts' must be >= 1, got: " + notifyMaxAttempts);
        }
        if (notifyRetryWaitMs < 0) {
            errors.add("'notifyRetryWaitMs' must be >= 0, got: " + notifyRetryWaitMs);
        }
        if (runIntervalSeconds < 0) {
            errors.add("'runIntervalSeconds' must be >= 0, got: " + runIntervalSeconds);
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Engine configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Typed accessors
    // ---------------------------------------------------------------

    public DataSource resolveDataSource() {
        return DataSource.fromCode(dataSource);
    }

    public Bucket resolveBucket() {
        return Bucket.fromCode(bucket);
    }

    public Aggregation resolveAggregation() {
        return Aggregation.fromCode(aggregation);
    }

    public SeriesBuilder createSeriesBuilder() {
        return new SeriesBuilder(resolveBucket(), resolveAggregation());
    }

    public List<TrendDetector> createDetectors() {
        return DetectorFactory.createAll(detectors);
    }

    public SignificanceGate toSignificanceGate() {
        return new SignificanceGate(minGrowthRatePercent, minAnomalyStrength);
    }

    // ---------------------------------------------------------------
    // Getters / Setters (used by SnakeYAML)
    // ---------------------------------------------------------------

    public String getDataSource() {
        return dataSource;
    }

    public void setDataSource(String dataSource) {
        this.dataSource = dataSource;
    }

    public TimeWindow getTimeWindow() {
        return timeWindow;
    }

    public void setTimeWindow(TimeWindow timeWindow) {
        this.timeWindow = timeWindow;
    }

    public int getMinSampleSize() {
        return minSampleSize;
    }

    public void setMinSampleSize(int minSampleSize) {
        this.minSampleSize = minSampleSize;
    }

    public String getBucket() {
        return bucket;
    }

    public void setBucket(String bucket) {
        this.bucket = bucket;
    }

    public String getAggregation() {
        return aggregation;
    }

    public void setAggregation(String aggregation) {
        this.aggregation = aggregation;
    }

    public List<String> getDetectors() {
        return Collections.unmodifiableList(detectors);
    }

    public void setDetectors(List<String> detectors) {
        this.detectors = detectors != null ? new ArrayList<>(detectors) : new ArrayList<>();
    }

    public double getMinGrowthRatePercent() {
        return minGrowthRatePercent;
    }

    public void setMinGrowthRatePercent(double minGrowthRatePercent) {
        this.minGrowthRatePercent = minGrowthRatePercent;
    }

    public double getMinAnomalyStrength() {
        return minAnomalyStrength;
    }

    public void setMinAnomalyStrength(double minAnomalyStrength) {
        this.minAnomalyStrength = minAnomalyStrength;
    }

    public int getParallelism() {
        return parallelism;
    }

    public void setParallelism(int parallelism) {
        this.parallelism = parallelism;
    }

    public long getSeriesTimeoutMs() {
        return seriesTimeoutMs;
    }

    public void setSeriesTimeoutMs(long seriesTimeoutMs) {
        this.seriesTimeoutMs = seriesTimeoutMs;
    }

    public int getNotifyMaxAttempts() {
        return notifyMaxAttempts;
    }

    public void setNotifyMaxAttempts(int notifyMaxAttempts) {
        this.notifyMaxAttempts = notifyMaxAttempts;
    }

    public long getNotifyRetryWaitMs() {
        return notifyRetryWaitMs;
    }

    public void setNotifyRetryWaitMs(long notifyRetryWaitMs) {
        this.notifyRetryWaitMs = notifyRetryWaitMs;
    }

    public long getRunIntervalSeconds() {
        return runIntervalSeconds;
    }

    public void setRunIntervalSeconds(long runIntervalSeconds) {
        this.runIntervalSeconds = runIntervalSeconds;
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "dataSource='" + dataSource + '\'' +
                ", timeWindow=" + timeWindow +
                ", minSampleSize=" + minSampleSize +
                ", bucket='" + bucket + '\'' +
                ", aggregation='" + aggregation + '\'' +
                ", detectors=" + detectors +
                ", minGrowthRatePercent=" + minGrowthRatePercent +
                ", minAnomalyStrength=" + minAnomalyStrength +
                ", parallelism=" + parallelism +
                ", seriesTimeoutMs=" + seriesTimeoutMs +
                ", notifyMaxAttempts=" + notifyMaxAttempts +
                ", notifyRetryWaitMs=" + notifyRetryWaitMs +
                ", runIntervalSeconds=" + runIntervalSeconds +
                '}';
    }
}
