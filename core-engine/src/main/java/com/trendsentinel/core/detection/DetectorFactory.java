package com.trendsentinel.core.detection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Factory that creates {@link TrendDetector} instances from their registry
 * names.
 *
 * <p>
 * This is the single point of extension when adding a detector: register its
 * name here and create the corresponding implementation. The default set
 * runs in a fixed order (moving average, change point, seasonality,
 * anomaly), which is also the order of the candidates a classifier reports.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectorFactory {

    private static final Logger LOG = LoggerFactory.getLogger(DetectorFactory.class);

    /** Registry names of the built-in detectors, in evaluation order. */
    public static final List<String> DEFAULT_DETECTORS = List.of(
            MovingAverageDetector.NAME,
            ChangePointDetector.NAME,
            SeasonalityDetector.NAME,
            ZScoreAnomalyDetector.NAME);

    private DetectorFactory() {
        // utility class, not instantiable
    }

    /**
     * Create a detector by name.
     *
     * @param name detector name, case-insensitive; must not be {@code null}
     * @return a new detector instance
     * @throws NullPointerException     if {@code name} is {@code null}
     * @throws IllegalArgumentException if the name is unknown
     */
    public static TrendDetector create(String name) {
        Objects.requireNonNull(name, "Detector name must not be null");

        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case MovingAverageDetector.NAME -> new MovingAverageDetector();
            case ChangePointDetector.NAME -> new ChangePointDetector();
            case SeasonalityDetector.NAME -> new SeasonalityDetector();
            case ZScoreAnomalyDetector.NAME -> new ZScoreAnomalyDetector();
            default -> throw new IllegalArgumentException(
                    "Unknown detector: '" + name
                            + "'. Supported detectors: " + String.join(", ", DEFAULT_DETECTORS));
        };
    }

    /**
     * Create detectors for every name in the supplied list, preserving order.
     *
     * @param names detector names; must not be {@code null}
     * @return unmodifiable list of detectors
     */
    public static List<TrendDetector> createAll(List<String> names) {
        Objects.requireNonNull(names, "Detector names must not be null");
        LOG.info("Creating {} detector(s): {}", names.size(), names);
        return names.stream()
                .map(DetectorFactory::create)
                .toList();
    }

    /**
     * @return the built-in detector set in evaluation order
     */
    public static List<TrendDetector> createDefault() {
        return createAll(DEFAULT_DETECTORS);
    }
}
