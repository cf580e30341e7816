package org.puneet.methcomp.util;

import org.puneet.methcomp.statistical.DifferenceMode;

import java.util.Objects;

/**
 * Immutable configuration for one method comparison call.
 * Every analysis takes its options from an instance passed explicitly,
 * so concurrent callers never share mutable defaults.
 *
 * <p>Instances are derived from {@link #defaults()} (or from
 * {@link ComparisonConfigLoader}) through the {@code with*} methods, each of
 * which validates its argument and returns a new configuration.</p>
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-02
 */
public final class ComparisonConfig {

    // ===================================================================================
    // DEFAULTS
    // ===================================================================================

    /** Confidence level for all intervals (95% = standard in method comparison) */
    public static final double DEFAULT_CONFIDENCE_LEVEL = 0.95;

    /** SD multiplier of the limits of agreement (~95% coverage under normality) */
    public static final double DEFAULT_LIMIT_OF_AGREEMENT = 1.96;

    /** Deming ratio of the y error variance to the x error variance */
    public static final double DEFAULT_VARIANCE_RATIO = 1.0;

    /** Deming bootstrap replicates; 0 disables bootstrapping */
    public static final int DEFAULT_BOOTSTRAP_ITERATIONS = 1000;

    /** Random seed for reproducible bootstrap resampling */
    public static final long DEFAULT_RANDOM_SEED = 123456L;

    /** Grid points of the mountain plot */
    public static final int DEFAULT_MOUNTAIN_PERCENTILES = 100;

    /** Central range of the mountain plot, in percent (one SD under normality) */
    public static final double DEFAULT_MOUNTAIN_CENTRAL_RANGE = 68.27;

    /** Pair count from which Passing-Bablok computes its slopes in parallel */
    public static final int DEFAULT_PARALLEL_THRESHOLD = 2000;

    private static final ComparisonConfig DEFAULTS = new ComparisonConfig(
        DifferenceMode.ABSOLUTE, DEFAULT_LIMIT_OF_AGREEMENT, DEFAULT_CONFIDENCE_LEVEL, true,
        DEFAULT_VARIANCE_RATIO, DEFAULT_BOOTSTRAP_ITERATIONS, DEFAULT_RANDOM_SEED,
        DEFAULT_MOUNTAIN_PERCENTILES, DEFAULT_MOUNTAIN_CENTRAL_RANGE, DEFAULT_PARALLEL_THRESHOLD);

    private final DifferenceMode differenceMode;
    private final double limitOfAgreement;
    private final double confidenceLevel;
    private final boolean confidenceIntervals;
    private final double varianceRatio;
    private final int bootstrapIterations;
    private final long randomSeed;
    private final int mountainPercentiles;
    private final double mountainCentralRange;
    private final int parallelThreshold;

    private ComparisonConfig(DifferenceMode differenceMode, double limitOfAgreement,
                             double confidenceLevel, boolean confidenceIntervals,
                             double varianceRatio, int bootstrapIterations, long randomSeed,
                             int mountainPercentiles, double mountainCentralRange,
                             int parallelThreshold) {
        this.differenceMode = Objects.requireNonNull(differenceMode, "Difference mode cannot be null");
        this.limitOfAgreement = limitOfAgreement;
        this.confidenceLevel = confidenceLevel;
        this.confidenceIntervals = confidenceIntervals;
        this.varianceRatio = varianceRatio;
        this.bootstrapIterations = bootstrapIterations;
        this.randomSeed = randomSeed;
        this.mountainPercentiles = mountainPercentiles;
        this.mountainCentralRange = mountainCentralRange;
        this.parallelThreshold = parallelThreshold;
        validateParameters();
    }

    /**
     * Gets the built-in defaults.
     *
     * @return the default configuration
     */
    public static ComparisonConfig defaults() {
        return DEFAULTS;
    }

    /**
     * Validates all parameters to ensure they are within acceptable ranges.
     *
     * @throws IllegalArgumentException if any parameter is invalid
     */
    private void validateParameters() {
        if (!Double.isFinite(limitOfAgreement) || limitOfAgreement <= 0) {
            throw new IllegalArgumentException(
                "Limit of agreement multiplier must be a positive finite number, got: " + limitOfAgreement);
        }
        if (!(confidenceLevel > 0 && confidenceLevel < 1)) {
            throw new IllegalArgumentException(
                "Confidence level must be between 0 and 1 (exclusive), got: " + confidenceLevel);
        }
        if (!Double.isFinite(varianceRatio) || varianceRatio <= 0) {
            throw new IllegalArgumentException(
                "Variance ratio must be a positive finite number, got: " + varianceRatio);
        }
        if (bootstrapIterations < 0) {
            throw new IllegalArgumentException(
                "Bootstrap iterations cannot be negative, got: " + bootstrapIterations);
        }
        if (mountainPercentiles <= 0) {
            throw new IllegalArgumentException(
                "Mountain percentiles must be positive, got: " + mountainPercentiles);
        }
        if (!(mountainCentralRange >= 0 && mountainCentralRange <= 100)) {
            throw new IllegalArgumentException(
                "Mountain central range must be in [0, 100], got: " + mountainCentralRange);
        }
        if (parallelThreshold < 2) {
            throw new IllegalArgumentException(
                "Parallel threshold must be at least 2, got: " + parallelThreshold);
        }
    }

    public ComparisonConfig withDifferenceMode(DifferenceMode mode) {
        return new ComparisonConfig(mode, limitOfAgreement, confidenceLevel, confidenceIntervals,
            varianceRatio, bootstrapIterations, randomSeed, mountainPercentiles,
            mountainCentralRange, parallelThreshold);
    }

    public ComparisonConfig withLimitOfAgreement(double multiplier) {
        return new ComparisonConfig(differenceMode, multiplier, confidenceLevel, confidenceIntervals,
            varianceRatio, bootstrapIterations, randomSeed, mountainPercentiles,
            mountainCentralRange, parallelThreshold);
    }

    public ComparisonConfig withConfidenceLevel(double level) {
        return new ComparisonConfig(differenceMode, limitOfAgreement, level, confidenceIntervals,
            varianceRatio, bootstrapIterations, randomSeed, mountainPercentiles,
            mountainCentralRange, parallelThreshold);
    }

    /**
     * Enables or disables the Bland-Altman confidence intervals.
     *
     * @param enabled true to compute intervals for bias and limits
     * @return a new configuration
     */
    public ComparisonConfig withConfidenceIntervals(boolean enabled) {
        return new ComparisonConfig(differenceMode, limitOfAgreement, confidenceLevel, enabled,
            varianceRatio, bootstrapIterations, randomSeed, mountainPercentiles,
            mountainCentralRange, parallelThreshold);
    }

    public ComparisonConfig withVarianceRatio(double ratio) {
        return new ComparisonConfig(differenceMode, limitOfAgreement, confidenceLevel, confidenceIntervals,
            ratio, bootstrapIterations, randomSeed, mountainPercentiles,
            mountainCentralRange, parallelThreshold);
    }

    public ComparisonConfig withBootstrapIterations(int iterations) {
        return new ComparisonConfig(differenceMode, limitOfAgreement, confidenceLevel, confidenceIntervals,
            varianceRatio, iterations, randomSeed, mountainPercentiles,
            mountainCentralRange, parallelThreshold);
    }

    public ComparisonConfig withRandomSeed(long seed) {
        return new ComparisonConfig(differenceMode, limitOfAgreement, confidenceLevel, confidenceIntervals,
            varianceRatio, bootstrapIterations, seed, mountainPercentiles,
            mountainCentralRange, parallelThreshold);
    }

    public ComparisonConfig withMountainPercentiles(int percentiles) {
        return new ComparisonConfig(differenceMode, limitOfAgreement, confidenceLevel, confidenceIntervals,
            varianceRatio, bootstrapIterations, randomSeed, percentiles,
            mountainCentralRange, parallelThreshold);
    }

    public ComparisonConfig withMountainCentralRange(double range) {
        return new ComparisonConfig(differenceMode, limitOfAgreement, confidenceLevel, confidenceIntervals,
            varianceRatio, bootstrapIterations, randomSeed, mountainPercentiles,
            range, parallelThreshold);
    }

    public ComparisonConfig withParallelThreshold(int threshold) {
        return new ComparisonConfig(differenceMode, limitOfAgreement, confidenceLevel, confidenceIntervals,
            varianceRatio, bootstrapIterations, randomSeed, mountainPercentiles,
            mountainCentralRange, threshold);
    }

    // Getters
    public DifferenceMode getDifferenceMode() { return differenceMode; }
    public double getLimitOfAgreement() { return limitOfAgreement; }
    public double getConfidenceLevel() { return confidenceLevel; }
    public boolean isConfidenceIntervals() { return confidenceIntervals; }
    public double getVarianceRatio() { return varianceRatio; }
    public int getBootstrapIterations() { return bootstrapIterations; }
    public long getRandomSeed() { return randomSeed; }
    public int getMountainPercentiles() { return mountainPercentiles; }
    public double getMountainCentralRange() { return mountainCentralRange; }
    public int getParallelThreshold() { return parallelThreshold; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ComparisonConfig that = (ComparisonConfig) o;
        return Double.compare(that.limitOfAgreement, limitOfAgreement) == 0
            && Double.compare(that.confidenceLevel, confidenceLevel) == 0
            && confidenceIntervals == that.confidenceIntervals
            && Double.compare(that.varianceRatio, varianceRatio) == 0
            && bootstrapIterations == that.bootstrapIterations
            && randomSeed == that.randomSeed
            && mountainPercentiles == that.mountainPercentiles
            && Double.compare(that.mountainCentralRange, mountainCentralRange) == 0
            && parallelThreshold == that.parallelThreshold
            && differenceMode == that.differenceMode;
    }

    @Override
    public int hashCode() {
        return Objects.hash(differenceMode, limitOfAgreement, confidenceLevel, confidenceIntervals,
            varianceRatio, bootstrapIterations, randomSeed, mountainPercentiles,
            mountainCentralRange, parallelThreshold);
    }

    @Override
    public String toString() {
        return String.format(
            "ComparisonConfig[mode=%s, loa=%.2f, CI=%.3f, intervals=%s, vr=%.3f, bootstrap=%d, "
                + "seed=%d, percentiles=%d, centralRange=%.2f, parallelThreshold=%d]",
            differenceMode.getDisplayName(), limitOfAgreement, confidenceLevel, confidenceIntervals,
            varianceRatio, bootstrapIterations, randomSeed, mountainPercentiles,
            mountainCentralRange, parallelThreshold);
    }
}
