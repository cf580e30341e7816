package org.puneet.methcomp.statistical;

import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.puneet.methcomp.exceptions.StatisticalValidationException;
import org.puneet.methcomp.exceptions.ValidationException;
import org.puneet.methcomp.model.MeasurementSeries;
import org.puneet.methcomp.util.ComparisonConfig;
import org.puneet.methcomp.util.InputValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Mountain plot statistics: the empirical CDF of the differences {@code y - x}
 * folded at the median, evaluated on an even grid of probabilities.
 * The area under the folded curve equals the mean absolute deviation from
 * the median, so bias and spread can be read off one curve.
 *
 * <p>Quantiles interpolate linearly between order statistics (Hyndman-Fan
 * type 7).</p>
 *
 * <p>Note the sign: differences are method 2 minus method 1, the same as
 * {@link BlandAltmanAnalyzer}. Tools that plot {@code x - y} show the mirror
 * image of this curve; pass the series {@code swapped()} to match them.</p>
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-03
 */
public class MountainAnalyzer {
    private static final Logger logger = LoggerFactory.getLogger(MountainAnalyzer.class);

    static final String ANALYSIS = "Mountain";

    /**
     * Computes the folded CDF.
     *
     * @param series the paired measurements, at least one pair
     * @param config grid size and central range
     * @return the result
     * @throws ValidationException if the series is empty
     * @throws StatisticalValidationException if a difference overflows the double range
     */
    public MountainResult analyze(MeasurementSeries series, ComparisonConfig config)
            throws ValidationException, StatisticalValidationException {
        Objects.requireNonNull(series, "Series cannot be null");
        Objects.requireNonNull(config, "Config cannot be null");
        InputValidator.validateCount(series.size(), 1, ANALYSIS);

        int n = series.size();
        int points = config.getMountainPercentiles();
        double range = config.getMountainCentralRange();
        logger.info("Computing {} over {} pairs on {} grid points", ANALYSIS, n, points);

        double[] differences = new double[n];
        for (int i = 0; i < n; i++) {
            differences[i] = series.y(i) - series.x(i);
            if (!Double.isFinite(differences[i])) {
                throw StatisticalValidationException.numericOverflow(ANALYSIS, "difference", i, n);
            }
        }

        Percentile percentile = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
        percentile.setData(differences);
        double min = StatUtils.min(differences);

        double[] quantiles = new double[points];
        double[] folded = new double[points];
        for (int k = 0; k < points; k++) {
            double q = points == 1 ? 0.0 : (double) k / (points - 1);
            quantiles[k] = quantile(percentile, min, q);
            folded[k] = (q < 0.5 ? q : 1.0 - q) * 100.0;
        }

        double auc = 0.0;
        for (int k = 0; k + 1 < points; k++) {
            auc += (quantiles[k + 1] - quantiles[k]) * (folded[k] + folded[k + 1]) / 2.0;
        }
        if (!Double.isFinite(auc)) {
            throw StatisticalValidationException.numericOverflow(ANALYSIS, "area under the curve", null, n);
        }

        double lower = quantile(percentile, min, 0.5 - range / 200.0);
        double upper = quantile(percentile, min, 0.5 + range / 200.0);
        int lowerIndex = nearestIndex(quantiles, lower);
        int upperIndex = nearestIndex(quantiles, upper);

        MountainResult result = new MountainResult(folded, quantiles, auc, points / 2,
            range, lower, upper, lowerIndex, upperIndex, n);
        logger.info("{} completed: {}", ANALYSIS, result);
        return result;
    }

    private static double quantile(Percentile percentile, double min, double probability) {
        // Percentile rejects p == 0; type 7 gives the minimum there
        if (probability <= 0.0) {
            return min;
        }
        return percentile.evaluate(Math.min(100.0, probability * 100.0));
    }

    private static int nearestIndex(double[] values, double target) {
        int best = 0;
        double bestDistance = Math.abs(values[0] - target);
        for (int i = 1; i < values.length; i++) {
            double distance = Math.abs(values[i] - target);
            if (distance < bestDistance) {
                best = i;
                bestDistance = distance;
            }
        }
        return best;
    }
}
