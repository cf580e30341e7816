package org.puneet.methcomp.statistical;

import java.util.Objects;

/**
 * Immutable confidence interval around one estimated statistic (a bias, a
 * limit of agreement, a regression slope or intercept).
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-02
 */
public final class ConfidenceInterval {

    private final double lowerBound;
    private final double upperBound;
    private final double estimate;
    private final double standardError;
    private final double confidenceLevel;
    private final int sampleSize;
    private final String methodUsed;

    /**
     * Creates a confidence interval with specified bounds and parameters.
     *
     * @param lowerBound the lower bound of the interval
     * @param upperBound the upper bound of the interval
     * @param estimate the point estimate the interval surrounds
     * @param standardError the standard error of the estimate, NaN for rank based intervals
     * @param confidenceLevel the confidence level (e.g., 0.95 for 95%)
     * @param sampleSize the number of pairs
     * @param methodUsed the statistical method used for calculation
     * @throws IllegalArgumentException if any parameter is invalid
     */
    public ConfidenceInterval(double lowerBound, double upperBound, double estimate,
                              double standardError, double confidenceLevel,
                              int sampleSize, String methodUsed) {
        validateParameters(lowerBound, upperBound, confidenceLevel, sampleSize);

        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
        this.estimate = estimate;
        this.standardError = standardError;
        this.confidenceLevel = confidenceLevel;
        this.sampleSize = sampleSize;
        this.methodUsed = Objects.requireNonNull(methodUsed, "Method used cannot be null");
    }

    /**
     * Computes the width of the confidence interval.
     *
     * @return the width (upper bound - lower bound)
     */
    public double getWidth() {
        return upperBound - lowerBound;
    }

    /**
     * Checks if a value lies within the closed interval.
     *
     * @param value the value to test
     * @return true if {@code lower <= value <= upper}
     */
    public boolean contains(double value) {
        return lowerBound <= value && value <= upperBound;
    }

    /**
     * Checks if the confidence interval contains zero.
     *
     * @return true if zero is within the interval
     */
    public boolean containsZero() {
        return contains(0.0);
    }

    /**
     * Checks if this interval overlaps with another interval.
     *
     * @param other the other confidence interval
     * @return true if intervals overlap
     * @throws NullPointerException if other is null
     */
    public boolean overlaps(ConfidenceInterval other) {
        Objects.requireNonNull(other, "Other interval cannot be null");
        return this.lowerBound <= other.upperBound && this.upperBound >= other.lowerBound;
    }

    @Override
    public String toString() {
        return String.format("[%.4f, %.4f] (estimate=%.4f, n=%d, %.0f%% CI, method=%s)",
            lowerBound, upperBound, estimate, sampleSize, confidenceLevel * 100, methodUsed);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConfidenceInterval)) return false;
        ConfidenceInterval that = (ConfidenceInterval) o;
        return Double.compare(lowerBound, that.lowerBound) == 0
            && Double.compare(upperBound, that.upperBound) == 0
            && Double.compare(estimate, that.estimate) == 0
            && Double.compare(standardError, that.standardError) == 0
            && Double.compare(confidenceLevel, that.confidenceLevel) == 0
            && sampleSize == that.sampleSize
            && methodUsed.equals(that.methodUsed);
    }

    @Override
    public int hashCode() {
        return Objects.hash(lowerBound, upperBound, estimate, standardError,
            confidenceLevel, sampleSize, methodUsed);
    }

    // Getters
    public double getLowerBound() { return lowerBound; }
    public double getUpperBound() { return upperBound; }
    public double getEstimate() { return estimate; }
    public double getStandardError() { return standardError; }
    public double getConfidenceLevel() { return confidenceLevel; }
    public int getSampleSize() { return sampleSize; }
    public String getMethodUsed() { return methodUsed; }

    /**
     * Validates input parameters for confidence interval calculation.
     */
    private static void validateParameters(double lowerBound, double upperBound,
                                           double confidenceLevel, int sampleSize) {
        if (Double.isNaN(lowerBound) || Double.isNaN(upperBound)) {
            throw new IllegalArgumentException("Interval bounds cannot be NaN");
        }
        if (lowerBound > upperBound) {
            throw new IllegalArgumentException(
                "Lower bound must be less than or equal to upper bound");
        }
        if (!(confidenceLevel > 0 && confidenceLevel < 1)) {
            throw new IllegalArgumentException(
                "Confidence level must be between 0 and 1");
        }
        if (sampleSize < 1) {
            throw new IllegalArgumentException(
                "Sample size must be at least 1");
        }
    }
}
