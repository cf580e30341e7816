package org.puneet.methcomp.regression;

import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.puneet.methcomp.exceptions.StatisticalValidationException;
import org.puneet.methcomp.exceptions.ValidationException;
import org.puneet.methcomp.model.MeasurementSeries;
import org.puneet.methcomp.statistical.ConfidenceInterval;
import org.puneet.methcomp.statistical.ConfidenceIntervalCalculator;
import org.puneet.methcomp.util.ComparisonConfig;
import org.puneet.methcomp.util.InputValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Objects;
import java.util.Random;

/**
 * Deming regression: least squares with measurement error in both methods,
 * the ratio of the two error variances being known ({@code lambda}).
 *
 * <p>The line is fitted analytically. Confidence intervals come from a
 * seeded pairs bootstrap: pairs are resampled with replacement, the line is
 * refitted, and the percentile interval of the replicate coefficients is
 * reported. Replicates without a defined slope (e.g. every resampled x equal)
 * are skipped. Point estimates always come from the full sample.</p>
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-04
 */
public class DemingRegression implements Regressor<DemingResult> {
    private static final Logger logger = LoggerFactory.getLogger(DemingRegression.class);

    public static final String METHOD = "Deming";

    /** Pairs needed for the error variance estimate. */
    public static final int MIN_PAIRS = 3;

    @Override
    public String getName() {
        return METHOD;
    }

    @Override
    public DemingResult fit(MeasurementSeries series, ComparisonConfig config)
            throws ValidationException, StatisticalValidationException {
        Objects.requireNonNull(series, "Series cannot be null");
        Objects.requireNonNull(config, "Config cannot be null");
        InputValidator.validateCount(series.size(), MIN_PAIRS, METHOD);

        int n = series.size();
        double lambda = config.getVarianceRatio();
        double level = config.getConfidenceLevel();
        double[] x = series.xValues();
        double[] y = series.yValues();
        logger.info("Starting {} over {} pairs (lambda={})", METHOD, n, lambda);

        double[] line = fitLine(x, y, lambda);
        if (line[2] == 0.0) {
            throw StatisticalValidationException.degenerateRegression(METHOD, n,
                "x and y have zero covariance");
        }
        if (!Double.isFinite(line[0]) || !Double.isFinite(line[1])) {
            throw StatisticalValidationException.numericOverflow(METHOD, "slope or intercept", null, n);
        }
        double slope = line[0];
        double intercept = line[1];

        // error variance from the residuals to the latent true values
        double sumX = 0.0;
        double sumY = 0.0;
        for (int i = 0; i < n; i++) {
            double xi = (lambda * x[i] + slope * (y[i] - intercept)) / (lambda + slope * slope);
            sumX += (x[i] - xi) * (x[i] - xi);
            double ry = y[i] - intercept - slope * xi;
            sumY += ry * ry;
        }
        double sigma2 = (lambda * sumX + sumY) / (2.0 * lambda * (n - 2));
        if (!Double.isFinite(sigma2)) {
            throw StatisticalValidationException.numericOverflow(METHOD, "error variance", null, n);
        }
        double sigmaX = Math.sqrt(sigma2);
        double sigmaY = Math.sqrt(lambda * sigma2);
        logger.debug("slope={}, intercept={}, sigmaX={}, sigmaY={}", slope, intercept, sigmaX, sigmaY);

        ConfidenceInterval slopeInterval = null;
        ConfidenceInterval interceptInterval = null;
        int replicates = 0;
        int iterations = config.getBootstrapIterations();

        if (iterations > 0) {
            double[] slopes = new double[iterations];
            double[] intercepts = new double[iterations];
            Random random = new Random(config.getRandomSeed());
            double[] bx = new double[n];
            double[] by = new double[n];

            for (int b = 0; b < iterations; b++) {
                for (int i = 0; i < n; i++) {
                    int pick = random.nextInt(n);
                    bx[i] = x[pick];
                    by[i] = y[pick];
                }
                double[] replicate = fitLine(bx, by, lambda);
                if (Double.isFinite(replicate[0]) && Double.isFinite(replicate[1])) {
                    slopes[replicates] = replicate[0];
                    intercepts[replicates] = replicate[1];
                    replicates++;
                }
            }

            if (replicates < iterations) {
                logger.warn("{}: {} of {} bootstrap replicates had no defined slope and were skipped",
                    METHOD, iterations - replicates, iterations);
            }
            if (replicates == 0) {
                throw StatisticalValidationException.confidenceIntervalError(METHOD + " slope", level,
                    new IllegalStateException("no bootstrap replicate produced a finite line"));
            }

            slopeInterval = percentileInterval(slope, Arrays.copyOf(slopes, replicates), level, n);
            interceptInterval = percentileInterval(intercept, Arrays.copyOf(intercepts, replicates), level, n);
        }

        DemingResult result = new DemingResult(slope, intercept, slopeInterval, interceptInterval,
            n, level, lambda, sigmaX, sigmaY, replicates);
        logger.info("{} completed: {}", METHOD, result);
        return result;
    }

    /**
     * Analytic Deming fit.
     *
     * @return {slope, intercept, sxy}; slope and intercept are NaN when the covariance is zero
     */
    static double[] fitLine(double[] x, double[] y, double lambda) {
        int n = x.length;
        double mx = 0.0;
        double my = 0.0;
        for (int i = 0; i < n; i++) {
            mx += x[i];
            my += y[i];
        }
        mx /= n;
        my /= n;

        double sxx = 0.0;
        double syy = 0.0;
        double sxy = 0.0;
        for (int i = 0; i < n; i++) {
            double dx = x[i] - mx;
            double dy = y[i] - my;
            sxx += dx * dx;
            syy += dy * dy;
            sxy += dx * dy;
        }
        if (sxy == 0.0) {
            return new double[] {Double.NaN, Double.NaN, sxy};
        }

        double u = syy - lambda * sxx;
        double slope = (u + Math.sqrt(u * u + 4.0 * lambda * sxy * sxy)) / (2.0 * sxy);
        return new double[] {slope, my - slope * mx, sxy};
    }

    private static ConfidenceInterval percentileInterval(double estimate, double[] replicates,
                                                         double level, int n) {
        Percentile percentile = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
        percentile.setData(replicates);
        double alpha = 1.0 - level;
        double lower = percentile.evaluate(alpha / 2.0 * 100.0);
        double upper = percentile.evaluate((1.0 - alpha / 2.0) * 100.0);
        return ConfidenceIntervalCalculator.ordered(estimate, lower, upper, level, n, "Bootstrap Percentile");
    }
}
