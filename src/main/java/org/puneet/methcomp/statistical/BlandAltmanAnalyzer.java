package org.puneet.methcomp.statistical;

import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.puneet.methcomp.exceptions.StatisticalValidationException;
import org.puneet.methcomp.exceptions.ValidationException;
import org.puneet.methcomp.model.MeasurementSeries;
import org.puneet.methcomp.util.ComparisonConfig;
import org.puneet.methcomp.util.InputValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Bland-Altman agreement analysis between two measurement methods.
 *
 * <p>Differences are {@code y - x} (or that difference as a percentage of the
 * pair mean), the bias is their mean and the limits of agreement are
 * {@code bias -/+ z * SD} with the sample standard deviation. Confidence
 * intervals use the Student-t critical value with {@code n - 1} degrees of
 * freedom: {@code SD / sqrt(n)} is the standard error of the bias and
 * {@code SD * sqrt(3 / n)} the standard error of each limit.</p>
 *
 * <p>Instances hold no state and may be shared between threads.</p>
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-02
 */
public class BlandAltmanAnalyzer {
    private static final Logger logger = LoggerFactory.getLogger(BlandAltmanAnalyzer.class);

    static final String ANALYSIS = "Bland-Altman";

    /**
     * Runs the analysis.
     *
     * @param series the paired measurements
     * @param config difference mode, SD multiplier, confidence level and interval flag
     * @return the complete result
     * @throws ValidationException if the series has fewer than 2 pairs
     * @throws StatisticalValidationException if a relative difference divides by a zero mean,
     *         a difference, mean or moment overflows, or an interval cannot be formed
     */
    public BlandAltmanResult analyze(MeasurementSeries series, ComparisonConfig config)
            throws ValidationException, StatisticalValidationException {
        Objects.requireNonNull(series, "Series cannot be null");
        Objects.requireNonNull(config, "Config cannot be null");
        InputValidator.validateCount(series.size(), InputValidator.MIN_PAIRS, ANALYSIS);

        int n = series.size();
        DifferenceMode mode = config.getDifferenceMode();
        logger.info("Starting {} analysis over {} pairs ({} differences)", ANALYSIS, n, mode.getDisplayName());

        double[] means = new double[n];
        double[] differences = new double[n];
        for (int i = 0; i < n; i++) {
            double x = series.x(i);
            double y = series.y(i);
            means[i] = (x + y) / 2.0;
            if (mode == DifferenceMode.RELATIVE) {
                if (means[i] == 0.0) {
                    throw StatisticalValidationException.divisionByZero(i, n);
                }
                differences[i] = (y - x) / means[i] * 100.0;
            } else {
                differences[i] = y - x;
            }
            if (!Double.isFinite(means[i]) || !Double.isFinite(differences[i])) {
                throw StatisticalValidationException.numericOverflow(ANALYSIS, "difference or mean", i, n);
            }
        }

        DescriptiveStatistics stats = new DescriptiveStatistics(differences);
        double bias = stats.getMean();
        double sd = stats.getStandardDeviation();
        if (!Double.isFinite(bias) || !Double.isFinite(sd)) {
            throw StatisticalValidationException.numericOverflow(ANALYSIS, "bias or standard deviation", null, n);
        }
        double z = config.getLimitOfAgreement();
        logger.debug("bias={}, sd={}, z={}", bias, sd, z);

        ConfidenceInterval biasInterval = null;
        ConfidenceInterval lowerInterval = null;
        ConfidenceInterval upperInterval = null;

        if (config.isConfidenceIntervals()) {
            double level = config.getConfidenceLevel();
            try {
                double t = ConfidenceIntervalCalculator.tCritical(n - 1, level);
                double seBias = sd / Math.sqrt(n);
                double seLimit = sd * Math.sqrt(3.0 / n);

                biasInterval = ConfidenceIntervalCalculator.symmetric(
                    bias, t * seBias, seBias, level, n, "t-Distribution");
                lowerInterval = ConfidenceIntervalCalculator.symmetric(
                    bias - z * sd, t * seLimit, seLimit, level, n, "t-Distribution");
                upperInterval = ConfidenceIntervalCalculator.symmetric(
                    bias + z * sd, t * seLimit, seLimit, level, n, "t-Distribution");
            } catch (MathIllegalArgumentException e) {
                throw StatisticalValidationException.confidenceIntervalError(ANALYSIS, level, e);
            }
        }

        BlandAltmanResult result = new BlandAltmanResult(means, differences, mode, bias, sd, z,
            biasInterval, lowerInterval, upperInterval);
        logger.info("{} analysis completed: {}", ANALYSIS, result);
        return result;
    }
}
