package org.puneet.methcomp.regression;

import org.puneet.methcomp.statistical.ConfidenceInterval;

import java.util.Objects;
import java.util.Optional;

/**
 * Regression line {@code y = intercept + slope * x} relating method 2 to
 * method 1, with optional confidence intervals for both coefficients.
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-03
 */
public class RegressionResult {

    private final String method;
    private final double slope;
    private final double intercept;
    private final ConfidenceInterval slopeInterval;
    private final ConfidenceInterval interceptInterval;
    private final int sampleSize;
    private final double confidenceLevel;

    /**
     * Creates a regression result.
     *
     * @param method name of the regression method
     * @param slope estimated slope
     * @param intercept estimated intercept
     * @param slopeInterval interval around the slope, may be null
     * @param interceptInterval interval around the intercept, may be null
     * @param sampleSize number of pairs
     * @param confidenceLevel confidence level of the intervals
     */
    public RegressionResult(String method, double slope, double intercept,
                            ConfidenceInterval slopeInterval, ConfidenceInterval interceptInterval,
                            int sampleSize, double confidenceLevel) {
        this.method = Objects.requireNonNull(method, "Method cannot be null");
        this.slope = slope;
        this.intercept = intercept;
        this.slopeInterval = slopeInterval;
        this.interceptInterval = interceptInterval;
        this.sampleSize = sampleSize;
        this.confidenceLevel = confidenceLevel;
    }

    public String getMethod() { return method; }
    public double getSlope() { return slope; }
    public double getIntercept() { return intercept; }
    public int getSampleSize() { return sampleSize; }
    public double getConfidenceLevel() { return confidenceLevel; }

    public Optional<ConfidenceInterval> getSlopeInterval() {
        return Optional.ofNullable(slopeInterval);
    }

    public Optional<ConfidenceInterval> getInterceptInterval() {
        return Optional.ofNullable(interceptInterval);
    }

    /**
     * Evaluates the regression line.
     *
     * @param x a method 1 value
     * @return the method 2 value predicted by the line
     */
    public double predict(double x) {
        return intercept + slope * x;
    }

    /**
     * Checks for proportional bias: the slope interval excludes 1.
     *
     * @return true if an interval exists and does not contain 1
     */
    public boolean hasProportionalBias() {
        return slopeInterval != null && !slopeInterval.contains(1.0);
    }

    /**
     * Checks for constant bias: the intercept interval excludes 0.
     *
     * @return true if an interval exists and does not contain 0
     */
    public boolean hasConstantBias() {
        return interceptInterval != null && !interceptInterval.containsZero();
    }

    @Override
    public String toString() {
        return String.format("%s[n=%d, y = %.4f + %.4f * x, slopeCI=%s, interceptCI=%s]",
            method, sampleSize, intercept, slope,
            slopeInterval != null ? String.format("[%.4f, %.4f]", slopeInterval.getLowerBound(), slopeInterval.getUpperBound()) : "n/a",
            interceptInterval != null ? String.format("[%.4f, %.4f]", interceptInterval.getLowerBound(), interceptInterval.getUpperBound()) : "n/a");
    }
}
