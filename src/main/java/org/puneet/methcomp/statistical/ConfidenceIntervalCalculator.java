package org.puneet.methcomp.statistical;

import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.distribution.TDistribution;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared interval arithmetic for the method comparison analyses: Student-t and
 * standard normal critical values, clamped rank lookup into a sorted sample,
 * and construction of symmetric or bound-ordered intervals.
 *
 * <p>All methods are pure functions.</p>
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-02
 */
public final class ConfidenceIntervalCalculator {

    private static final Logger logger = LoggerFactory.getLogger(ConfidenceIntervalCalculator.class);

    private ConfidenceIntervalCalculator() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Two-sided Student-t critical value {@code t(1 - alpha/2, df)}.
     *
     * @param degreesOfFreedom degrees of freedom, at least 1
     * @param confidenceLevel confidence level in (0, 1)
     * @return the critical value
     * @throws IllegalArgumentException if an argument is out of range
     */
    public static double tCritical(int degreesOfFreedom, double confidenceLevel) {
        if (degreesOfFreedom < 1) {
            throw new IllegalArgumentException("Degrees of freedom must be at least 1, got: " + degreesOfFreedom);
        }
        checkLevel(confidenceLevel);
        TDistribution tDist = new TDistribution(degreesOfFreedom);
        return tDist.inverseCumulativeProbability(1 - (1 - confidenceLevel) / 2);
    }

    /**
     * Two-sided standard normal critical value {@code z(1 - alpha/2)}.
     *
     * @param confidenceLevel confidence level in (0, 1)
     * @return the critical value, 1.959964 for 0.95
     * @throws IllegalArgumentException if the level is out of range
     */
    public static double zCritical(double confidenceLevel) {
        checkLevel(confidenceLevel);
        return new NormalDistribution().inverseCumulativeProbability(1 - (1 - confidenceLevel) / 2);
    }

    /**
     * Looks up a 0-based index in a sorted sample, clamping it to the valid range.
     *
     * @param sorted ascending values
     * @param index the requested index, may fall outside the array
     * @return the value at the clamped index
     * @throws IllegalArgumentException if the sample is empty
     */
    public static double valueAtRank(double[] sorted, long index) {
        return sorted[clampIndex(sorted.length, index)];
    }

    /**
     * Clamps a 0-based index to {@code [0, length - 1]}.
     *
     * @param length the array length
     * @param index the requested index
     * @return the clamped index
     * @throws IllegalArgumentException if length is 0
     */
    public static int clampIndex(int length, long index) {
        if (length == 0) {
            throw new IllegalArgumentException("Cannot index into an empty sample");
        }
        if (index < 0 || index >= length) {
            long clamped = Math.max(0, Math.min(length - 1L, index));
            logger.debug("Rank index {} clamped to {} (size {})", index, clamped, length);
            return (int) clamped;
        }
        return (int) index;
    }

    /**
     * Median of a sample; the mean of the two central values for even sizes.
     *
     * @param values the sample, not modified
     * @return the median
     */
    public static double median(double[] values) {
        return new Median().evaluate(values);
    }

    /**
     * Builds {@code estimate -/+ halfWidth}.
     *
     * @param estimate the point estimate
     * @param halfWidth critical value times standard error
     * @param standardError the standard error
     * @param confidenceLevel the confidence level
     * @param sampleSize number of pairs
     * @param method name of the method
     * @return the interval
     */
    public static ConfidenceInterval symmetric(double estimate, double halfWidth, double standardError,
                                               double confidenceLevel, int sampleSize, String method) {
        return new ConfidenceInterval(estimate - halfWidth, estimate + halfWidth, estimate,
            standardError, confidenceLevel, sampleSize, method);
    }

    /**
     * Builds an interval from two bounds in either order.
     *
     * @param estimate the point estimate
     * @param boundA one bound
     * @param boundB the other bound
     * @param confidenceLevel the confidence level
     * @param sampleSize number of pairs
     * @param method name of the method
     * @return the interval with the smaller bound as lower bound
     */
    public static ConfidenceInterval ordered(double estimate, double boundA, double boundB,
                                             double confidenceLevel, int sampleSize, String method) {
        return new ConfidenceInterval(Math.min(boundA, boundB), Math.max(boundA, boundB), estimate,
            Double.NaN, confidenceLevel, sampleSize, method);
    }

    private static void checkLevel(double confidenceLevel) {
        if (!(confidenceLevel > 0 && confidenceLevel < 1)) {
            throw new IllegalArgumentException("Confidence level must be between 0 and 1, got: " + confidenceLevel);
        }
    }
}
