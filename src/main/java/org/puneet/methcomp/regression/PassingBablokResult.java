package org.puneet.methcomp.regression;

import org.puneet.methcomp.statistical.ConfidenceInterval;

/**
 * Passing-Bablok regression line with the pairwise slope diagnostics kept
 * from the estimation: the ranked slopes, the offset {@code K} and how many
 * index pairs were excluded and why.
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-03
 */
public final class PassingBablokResult extends RegressionResult {

    private final double[] slopes;
    private final int offset;
    private final int excludedVertical;
    private final int excludedDuplicate;
    private final int excludedMinusOne;
    private final double medianX;
    private final double medianY;

    public PassingBablokResult(double slope, double intercept,
                               ConfidenceInterval slopeInterval, ConfidenceInterval interceptInterval,
                               int sampleSize, double confidenceLevel, double[] slopes, int offset,
                               int excludedVertical, int excludedDuplicate, int excludedMinusOne,
                               double medianX, double medianY) {
        super(PassingBablokEstimator.METHOD, slope, intercept, slopeInterval, interceptInterval,
            sampleSize, confidenceLevel);
        this.slopes = slopes.clone();
        this.offset = offset;
        this.excludedVertical = excludedVertical;
        this.excludedDuplicate = excludedDuplicate;
        this.excludedMinusOne = excludedMinusOne;
        this.medianX = medianX;
        this.medianY = medianY;
    }

    /** @return the retained pairwise slopes, ascending */
    public double[] getSlopes() { return slopes.clone(); }

    /** @return N, the number of retained slopes */
    public int getSlopeCount() { return slopes.length; }

    /** @return K, the number of retained slopes below -1 */
    public int getOffset() { return offset; }

    public int getExcludedVertical() { return excludedVertical; }
    public int getExcludedDuplicate() { return excludedDuplicate; }
    public int getExcludedMinusOne() { return excludedMinusOne; }

    /**
     * @return true if any pair with equal x and different y was left out
     */
    public boolean hasVerticalPairs() {
        return excludedVertical > 0;
    }

    public double getMedianX() { return medianX; }
    public double getMedianY() { return medianY; }

    @Override
    public String toString() {
        return super.toString() + String.format(" {N=%d, K=%d, vertical=%d, duplicate=%d, minusOne=%d}",
            slopes.length, offset, excludedVertical, excludedDuplicate, excludedMinusOne);
    }
}
