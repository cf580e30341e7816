package org.puneet.methcomp.regression;

import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.puneet.methcomp.exceptions.StatisticalValidationException;
import org.puneet.methcomp.exceptions.ValidationException;
import org.puneet.methcomp.model.MeasurementSeries;
import org.puneet.methcomp.statistical.ConfidenceInterval;
import org.puneet.methcomp.statistical.ConfidenceIntervalCalculator;
import org.puneet.methcomp.util.ComparisonConfig;
import org.puneet.methcomp.util.InputValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Ordinary least squares of method 2 on method 1, the baseline against which
 * the error-in-both-variables fits are usually read.
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-04
 */
public class LinearRegression implements Regressor<RegressionResult> {
    private static final Logger logger = LoggerFactory.getLogger(LinearRegression.class);

    public static final String METHOD = "Linear";

    public static final int MIN_PAIRS = 3;

    @Override
    public String getName() {
        return METHOD;
    }

    @Override
    public RegressionResult fit(MeasurementSeries series, ComparisonConfig config)
            throws ValidationException, StatisticalValidationException {
        Objects.requireNonNull(series, "Series cannot be null");
        Objects.requireNonNull(config, "Config cannot be null");
        InputValidator.validateCount(series.size(), MIN_PAIRS, METHOD);

        int n = series.size();
        double level = config.getConfidenceLevel();
        logger.info("Starting {} regression over {} pairs", METHOD, n);

        SimpleRegression regression = new SimpleRegression();
        for (int i = 0; i < n; i++) {
            regression.addData(series.x(i), series.y(i));
        }
        if (regression.getXSumSquares() == 0.0) {
            throw StatisticalValidationException.degenerateRegression(METHOD, n, "x has zero variance");
        }

        double slope = regression.getSlope();
        double intercept = regression.getIntercept();
        double slopeSe = regression.getSlopeStdErr();
        double interceptSe = regression.getInterceptStdErr();
        if (!Double.isFinite(slope) || !Double.isFinite(intercept)
                || !Double.isFinite(slopeSe) || !Double.isFinite(interceptSe)) {
            throw StatisticalValidationException.numericOverflow(METHOD,
                "slope, intercept or standard error", null, n);
        }

        ConfidenceInterval slopeInterval;
        ConfidenceInterval interceptInterval;
        try {
            double t = ConfidenceIntervalCalculator.tCritical(n - 2, level);
            slopeInterval = ConfidenceIntervalCalculator.symmetric(
                slope, t * slopeSe, slopeSe, level, n, "t-Distribution");
            interceptInterval = ConfidenceIntervalCalculator.symmetric(
                intercept, t * interceptSe, interceptSe, level, n, "t-Distribution");
        } catch (MathIllegalArgumentException e) {
            throw StatisticalValidationException.confidenceIntervalError(METHOD + " slope", level, e);
        }
        logger.debug("slopeSE={}, interceptSE={}, r2={}", slopeSe, interceptSe, regression.getRSquare());

        RegressionResult result = new RegressionResult(METHOD, slope, intercept, slopeInterval, interceptInterval,
            n, level);
        logger.info("{} regression completed: {}", METHOD, result);
        return result;
    }
}
