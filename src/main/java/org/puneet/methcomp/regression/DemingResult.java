package org.puneet.methcomp.regression;

import org.puneet.methcomp.statistical.ConfidenceInterval;

/**
 * Deming regression line with the error model it was fitted under.
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-04
 */
public final class DemingResult extends RegressionResult {

    private final double varianceRatio;
    private final double sigmaX;
    private final double sigmaY;
    private final int bootstrapReplicates;

    public DemingResult(double slope, double intercept,
                        ConfidenceInterval slopeInterval, ConfidenceInterval interceptInterval,
                        int sampleSize, double confidenceLevel,
                        double varianceRatio, double sigmaX, double sigmaY, int bootstrapReplicates) {
        super(DemingRegression.METHOD, slope, intercept, slopeInterval, interceptInterval,
            sampleSize, confidenceLevel);
        this.varianceRatio = varianceRatio;
        this.sigmaX = sigmaX;
        this.sigmaY = sigmaY;
        this.bootstrapReplicates = bootstrapReplicates;
    }

    /** @return lambda, the assumed ratio of y to x error variance */
    public double getVarianceRatio() { return varianceRatio; }

    /** @return estimated measurement error SD of method 1 */
    public double getSigmaX() { return sigmaX; }

    /** @return estimated measurement error SD of method 2 */
    public double getSigmaY() { return sigmaY; }

    /** @return finite bootstrap replicates behind the intervals, 0 when none were drawn */
    public int getBootstrapReplicates() { return bootstrapReplicates; }

    @Override
    public String toString() {
        return super.toString() + String.format(" {lambda=%.4f, sigmaX=%.4f, sigmaY=%.4f, replicates=%d}",
            varianceRatio, sigmaX, sigmaY, bootstrapReplicates);
    }
}
