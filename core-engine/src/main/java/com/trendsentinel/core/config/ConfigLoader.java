package com.trendsentinel.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Loads and validates {@link EngineConfig} and {@link SubscriptionsConfig}
 * from YAML sources.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_CONFIG_PATH} (file system path)</li>
 * <li>Explicit file system path passed to {@link #engineFromFile(String)}</li>
 * <li>Classpath resource {@value #DEFAULT_ENGINE_RESOURCE}</li>
 * </ol>
 *
 * <h3>Validation</h3>
 * <p>
 * Every loader validates after parsing, so an invalid file fails at startup
 * instead of mid-run.
 * </p>
 *
 * @since 1.0.0
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    /** Environment variable that can override the default config location. */
    public static final String ENV_CONFIG_PATH = "TREND_ENGINE_CONFIG_PATH";

    public static final String DEFAULT_ENGINE_RESOURCE = "trend-engine.yml";

    private ConfigLoader() {
        // utility class, not instantiable
    }

    // ---------------------------------------------------------------
    // Engine configuration
    // ---------------------------------------------------------------

    /**
     * Load the engine configuration using automatic resolution: the file named
     * by {@value #ENV_CONFIG_PATH} if it exists, otherwise
     * {@value #DEFAULT_ENGINE_RESOURCE} on the classpath.
     *
     * @return parsed and validated configuration
     * @throws IllegalStateException if validation fails
     */
    public static EngineConfig loadEngine() {
        String envPath = System.getenv(ENV_CONFIG_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading engine config from environment path: {}", envPath);
            return engineFromFile(envPath);
        }
        LOG.info("Loading engine config from classpath: {}", DEFAULT_ENGINE_RESOURCE);
        return engineFromClasspath(DEFAULT_ENGINE_RESOURCE);
    }

    /**
     * @param path path to the YAML file
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading or validation fails
     */
    public static EngineConfig engineFromFile(String path) {
        Objects.requireNonNull(path, "Engine config path must not be null");
        return fromFile(path, ConfigLoader::parseEngine);
    }

    /**
     * @param resource classpath resource name
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading or validation fails
     */
    public static EngineConfig engineFromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        return fromClasspath(resource, ConfigLoader::parseEngine);
    }

    // ---------------------------------------------------------------
    // Subscriptions
    // ---------------------------------------------------------------

    public static SubscriptionsConfig subscriptionsFromFile(String path) {
        Objects.requireNonNull(path, "Subscriptions path must not be null");
        return fromFile(path, ConfigLoader::parseSubscriptions);
    }

    public static SubscriptionsConfig subscriptionsFromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        return fromClasspath(resource, ConfigLoader::parseSubscriptions);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    @FunctionalInterface
    private interface Parser<T> {
        T parse(InputStream is);
    }

    private static <T> T fromFile(String path, Parser<T> parser) {
        try (InputStream is = new FileInputStream(path)) {
            return parser.parse(is);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Config file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read config file: " + path, e);
        }
    }

    private static <T> T fromClasspath(String resource, Parser<T> parser) {
        InputStream is = ConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parser.parse(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    private static EngineConfig parseEngine(InputStream is) {
        EngineConfig config = load(is, EngineConfig.class, EngineConfig::new);
        config.validate();
        LOG.info("Loaded engine config: {}", config);
        return config;
    }

    private static SubscriptionsConfig parseSubscriptions(InputStream is) {
        SubscriptionsConfig config = load(is, SubscriptionsConfig.class, SubscriptionsConfig::new);
        if (config.getSubscriptions().isEmpty()) {
            LOG.warn("No alert subscriptions defined in configuration");
        } else {
            config.validate();
        }
        LOG.info("Loaded {} alert subscription(s)", config.getSubscriptions().size());
        return config;
    }

    private static <T> T load(InputStream is, Class<T> type, Supplier<T> empty) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(type, options));
        T config = yaml.load(is);
        return config != null ? config : empty.get();
    }
}
