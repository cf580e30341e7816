package org.puneet.methcomp.statistical;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a Bland-Altman analysis: per-pair means and differences, the
 * bias with its standard deviation, the limits of agreement and, when
 * requested, confidence intervals for the bias and each limit.
 *
 * <p>Immutable; array accessors return copies.</p>
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-02
 */
public final class BlandAltmanResult {

    private final double[] means;
    private final double[] differences;
    private final DifferenceMode mode;
    private final double bias;
    private final double standardDeviation;
    private final double limitOfAgreement;
    private final double lowerLimit;
    private final double upperLimit;
    private final ConfidenceInterval biasInterval;
    private final ConfidenceInterval lowerLimitInterval;
    private final ConfidenceInterval upperLimitInterval;

    /**
     * Creates a result. Interval arguments are either all present or all null.
     *
     * @param means per-pair means
     * @param differences per-pair differences
     * @param mode how the differences are expressed
     * @param bias mean of the differences
     * @param standardDeviation sample SD of the differences
     * @param limitOfAgreement the SD multiplier
     * @param biasInterval interval around the bias, may be null
     * @param lowerLimitInterval interval around the lower limit, may be null
     * @param upperLimitInterval interval around the upper limit, may be null
     */
    public BlandAltmanResult(double[] means, double[] differences, DifferenceMode mode,
                             double bias, double standardDeviation, double limitOfAgreement,
                             ConfidenceInterval biasInterval, ConfidenceInterval lowerLimitInterval,
                             ConfidenceInterval upperLimitInterval) {
        Objects.requireNonNull(means, "Means cannot be null");
        Objects.requireNonNull(differences, "Differences cannot be null");
        if (means.length != differences.length) {
            throw new IllegalArgumentException("Means and differences must have the same length");
        }
        boolean anyInterval = biasInterval != null || lowerLimitInterval != null || upperLimitInterval != null;
        boolean allIntervals = biasInterval != null && lowerLimitInterval != null && upperLimitInterval != null;
        if (anyInterval && !allIntervals) {
            throw new IllegalArgumentException("Confidence intervals must be supplied together");
        }

        this.means = means.clone();
        this.differences = differences.clone();
        this.mode = Objects.requireNonNull(mode, "Difference mode cannot be null");
        this.bias = bias;
        this.standardDeviation = standardDeviation;
        this.limitOfAgreement = limitOfAgreement;
        this.lowerLimit = bias - limitOfAgreement * standardDeviation;
        this.upperLimit = bias + limitOfAgreement * standardDeviation;
        this.biasInterval = biasInterval;
        this.lowerLimitInterval = lowerLimitInterval;
        this.upperLimitInterval = upperLimitInterval;
    }

    public double[] getMeans() { return means.clone(); }
    public double[] getDifferences() { return differences.clone(); }
    public DifferenceMode getMode() { return mode; }
    public double getBias() { return bias; }
    public double getStandardDeviation() { return standardDeviation; }
    public double getLimitOfAgreement() { return limitOfAgreement; }
    public double getLowerLimit() { return lowerLimit; }
    public double getUpperLimit() { return upperLimit; }
    public int getSampleSize() { return differences.length; }

    public boolean hasConfidenceIntervals() {
        return biasInterval != null;
    }

    public Optional<ConfidenceInterval> getBiasInterval() {
        return Optional.ofNullable(biasInterval);
    }

    public Optional<ConfidenceInterval> getLowerLimitInterval() {
        return Optional.ofNullable(lowerLimitInterval);
    }

    public Optional<ConfidenceInterval> getUpperLimitInterval() {
        return Optional.ofNullable(upperLimitInterval);
    }

    /**
     * Width of the limits of agreement, {@code 2 * z * SD}.
     *
     * @return upper limit minus lower limit
     */
    public double getAgreementWidth() {
        return upperLimit - lowerLimit;
    }

    @Override
    public String toString() {
        return String.format("BlandAltmanResult[n=%d, mode=%s, bias=%.4f, sd=%.4f, loa=[%.4f, %.4f]%s]",
            differences.length, mode.getDisplayName(), bias, standardDeviation, lowerLimit, upperLimit,
            biasInterval != null ? ", biasCI=" + biasInterval : "");
    }
}
