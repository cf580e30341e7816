package org.puneet.methcomp.util;

import org.puneet.methcomp.statistical.DifferenceMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Loads default analysis options from methcomp.properties.
 * Keys that are absent keep the built-in value of {@link ComparisonConfig#defaults()}.
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-02
 */
public class ComparisonConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ComparisonConfigLoader.class);

    public static final String CONFIG_FILE = "methcomp.properties";

    static final String KEY_DIFFERENCE_MODE = "blandaltman.difference";
    static final String KEY_LIMIT_OF_AGREEMENT = "blandaltman.limit-of-agreement";
    static final String KEY_CONFIDENCE_INTERVALS = "blandaltman.confidence-intervals";
    static final String KEY_CONFIDENCE_LEVEL = "confidence.level";
    static final String KEY_VARIANCE_RATIO = "deming.variance-ratio";
    static final String KEY_BOOTSTRAP = "deming.bootstrap";
    static final String KEY_RANDOM_SEED = "deming.random-seed";
    static final String KEY_PERCENTILES = "mountain.percentiles";
    static final String KEY_CENTRAL_RANGE = "mountain.central-range";
    static final String KEY_PARALLEL_THRESHOLD = "passingbablok.parallel-threshold";

    private final String resourceName;

    /**
     * Creates a loader for the default {@value #CONFIG_FILE} resource.
     */
    public ComparisonConfigLoader() {
        this(CONFIG_FILE);
    }

    /**
     * Creates a loader for a specific classpath resource.
     *
     * @param resourceName the resource to read
     */
    public ComparisonConfigLoader(String resourceName) {
        this.resourceName = resourceName;
    }

    /**
     * Loads the configuration from the classpath.
     *
     * @return the configuration
     * @throws IllegalStateException if the resource is missing or unreadable
     * @throws IllegalArgumentException if a value is malformed or out of range
     */
    public ComparisonConfig load() {
        Properties props = new Properties();

        try (InputStream inputStream = getClass().getClassLoader().getResourceAsStream(resourceName)) {
            if (inputStream == null) {
                throw new IllegalStateException("Configuration file " + resourceName + " not found in classpath");
            }

            props.load(inputStream);
            logger.info("Successfully loaded configuration from {}", resourceName);

        } catch (IOException e) {
            throw new IllegalStateException("Failed to load configuration from " + resourceName, e);
        }

        ComparisonConfig config = fromProperties(props, ComparisonConfig.defaults());
        logger.debug("Effective configuration: {}", config);
        return config;
    }

    /**
     * Overlays properties onto a base configuration.
     *
     * @param props the properties to read
     * @param base the configuration supplying values for absent keys
     * @return the merged configuration
     * @throws IllegalArgumentException if a value is malformed or out of range
     */
    public static ComparisonConfig fromProperties(Properties props, ComparisonConfig base) {
        ComparisonConfig config = base;

        String mode = props.getProperty(KEY_DIFFERENCE_MODE);
        if (mode != null) {
            config = config.withDifferenceMode(DifferenceMode.fromString(mode));
        }
        String intervals = props.getProperty(KEY_CONFIDENCE_INTERVALS);
        if (intervals != null) {
            config = config.withConfidenceIntervals(parseBoolean(KEY_CONFIDENCE_INTERVALS, intervals));
        }

        config = config
            .withLimitOfAgreement(getDoubleProperty(props, KEY_LIMIT_OF_AGREEMENT, config.getLimitOfAgreement()))
            .withConfidenceLevel(getDoubleProperty(props, KEY_CONFIDENCE_LEVEL, config.getConfidenceLevel()))
            .withVarianceRatio(getDoubleProperty(props, KEY_VARIANCE_RATIO, config.getVarianceRatio()))
            .withBootstrapIterations(getIntProperty(props, KEY_BOOTSTRAP, config.getBootstrapIterations()))
            .withRandomSeed(getLongProperty(props, KEY_RANDOM_SEED, config.getRandomSeed()))
            .withMountainPercentiles(getIntProperty(props, KEY_PERCENTILES, config.getMountainPercentiles()))
            .withMountainCentralRange(getDoubleProperty(props, KEY_CENTRAL_RANGE, config.getMountainCentralRange()))
            .withParallelThreshold(getIntProperty(props, KEY_PARALLEL_THRESHOLD, config.getParallelThreshold()));

        return config;
    }

    private static boolean parseBoolean(String key, String value) {
        String trimmed = value.trim();
        if ("true".equalsIgnoreCase(trimmed)) {
            return true;
        }
        if ("false".equalsIgnoreCase(trimmed)) {
            return false;
        }
        throw new IllegalArgumentException("Invalid value for '" + key + "': " + value);
    }

    private static double getDoubleProperty(Properties props, String key, double defaultValue) {
        String value = props.getProperty(key);
        if (value == null) return defaultValue;
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for '" + key + "': " + value, e);
        }
    }

    private static int getIntProperty(Properties props, String key, int defaultValue) {
        String value = props.getProperty(key);
        if (value == null) return defaultValue;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for '" + key + "': " + value, e);
        }
    }

    private static long getLongProperty(Properties props, String key, long defaultValue) {
        String value = props.getProperty(key);
        if (value == null) return defaultValue;
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for '" + key + "': " + value, e);
        }
    }
}
