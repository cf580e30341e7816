package org.puneet.methcomp.statistical;

/**
 * Folded empirical CDF (mountain plot) of the paired differences.
 * Immutable; array accessors return copies.
 */
public final class MountainResult {

    private final double[] foldedCdf;
    private final double[] quantiles;
    private final double areaUnderCurve;
    private final int medianIndex;
    private final double centralRange;
    private final double centralLower;
    private final double centralUpper;
    private final int centralLowerIndex;
    private final int centralUpperIndex;
    private final int sampleSize;

    public MountainResult(double[] foldedCdf, double[] quantiles, double areaUnderCurve, int medianIndex,
                          double centralRange, double centralLower, double centralUpper,
                          int centralLowerIndex, int centralUpperIndex, int sampleSize) {
        if (foldedCdf.length != quantiles.length) {
            throw new IllegalArgumentException("Folded CDF and quantiles must have the same length");
        }
        this.foldedCdf = foldedCdf.clone();
        this.quantiles = quantiles.clone();
        this.areaUnderCurve = areaUnderCurve;
        this.medianIndex = medianIndex;
        this.centralRange = centralRange;
        this.centralLower = centralLower;
        this.centralUpper = centralUpper;
        this.centralLowerIndex = centralLowerIndex;
        this.centralUpperIndex = centralUpperIndex;
        this.sampleSize = sampleSize;
    }

    /** @return folded CDF in percent at each grid point, peaking at 50 */
    public double[] getFoldedCdf() { return foldedCdf.clone(); }

    /** @return quantile of the differences at each grid point */
    public double[] getQuantiles() { return quantiles.clone(); }

    /** @return area under the folded curve */
    public double getAreaUnderCurve() { return areaUnderCurve; }

    public double getMedian() { return quantiles[medianIndex]; }
    public int getMedianIndex() { return medianIndex; }

    /** @return the central range in percent, e.g. 68.27 */
    public double getCentralRange() { return centralRange; }
    public double getCentralLower() { return centralLower; }
    public double getCentralUpper() { return centralUpper; }
    public int getCentralLowerIndex() { return centralLowerIndex; }
    public int getCentralUpperIndex() { return centralUpperIndex; }

    public double getCentralWidth() {
        return centralUpper - centralLower;
    }

    public int getSampleSize() { return sampleSize; }

    @Override
    public String toString() {
        return String.format("MountainResult[n=%d, points=%d, auc=%.4f, median=%.4f, %.2f%% range=[%.4f, %.4f]]",
            sampleSize, quantiles.length, areaUnderCurve, getMedian(), centralRange, centralLower, centralUpper);
    }
}
