package org.puneet.methcomp.util;

import org.puneet.methcomp.exceptions.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Utility class for validating paired measurement sequences and analysis
 * parameters before any statistic is computed.
 *
 * <p>Checks run in a fixed order (null, shape, values, count) and the first
 * failure aborts the call, so no partial result is ever produced from
 * partially invalid data.</p>
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-02
 */
public final class InputValidator {
    private static final Logger logger = LoggerFactory.getLogger(InputValidator.class);

    /** Pairs needed to estimate a dispersion or a slope */
    public static final int MIN_PAIRS = 2;

    /**
     * Private constructor to prevent instantiation
     */
    private InputValidator() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Validates two index-aligned sequences.
     *
     * @param x method 1 values
     * @param y method 2 values
     * @param minimumPairs minimum number of pairs the analysis needs
     * @param analysis name of the analysis, used in messages
     * @throws ValidationException if a sequence is null, the lengths differ,
     *         an element is not finite, or there are too few pairs
     */
    public static void validatePairs(double[] x, double[] y, int minimumPairs, String analysis)
            throws ValidationException {
        if (x == null) {
            throw ValidationException.nullValue("x");
        }
        if (y == null) {
            throw ValidationException.nullValue("y");
        }
        if (x.length != y.length) {
            logger.error("{}: length mismatch, x={} y={}", analysis, x.length, y.length);
            throw ValidationException.shapeMismatch(x.length, y.length);
        }

        for (int i = 0; i < x.length; i++) {
            if (!Double.isFinite(x[i])) {
                throw ValidationException.invalidValue("x", i, x[i]);
            }
            if (!Double.isFinite(y[i])) {
                throw ValidationException.invalidValue("y", i, y[i]);
            }
        }

        validateCount(x.length, minimumPairs, analysis);
        logger.debug("{}: validated {} pairs", analysis, x.length);
    }

    /**
     * Validates two index-aligned sequences of boxed values, where a null
     * element is a missing measurement and is rejected.
     *
     * @param x method 1 values
     * @param y method 2 values
     * @param minimumPairs minimum number of pairs the analysis needs
     * @param analysis name of the analysis, used in messages
     * @throws ValidationException on the first failed check
     */
    public static void validatePairs(List<Double> x, List<Double> y, int minimumPairs, String analysis)
            throws ValidationException {
        if (x == null) {
            throw ValidationException.nullValue("x");
        }
        if (y == null) {
            throw ValidationException.nullValue("y");
        }
        if (x.size() != y.size()) {
            logger.error("{}: length mismatch, x={} y={}", analysis, x.size(), y.size());
            throw ValidationException.shapeMismatch(x.size(), y.size());
        }

        for (int i = 0; i < x.size(); i++) {
            Double xi = x.get(i);
            if (xi == null || !Double.isFinite(xi)) {
                throw ValidationException.invalidValue("x", i, xi);
            }
            Double yi = y.get(i);
            if (yi == null || !Double.isFinite(yi)) {
                throw ValidationException.invalidValue("y", i, yi);
            }
        }

        validateCount(x.size(), minimumPairs, analysis);
    }

    /**
     * Validates the number of pairs.
     *
     * @param pairs the number of pairs
     * @param minimumPairs minimum number of pairs the analysis needs
     * @param analysis name of the analysis, used in messages
     * @throws ValidationException if there are too few pairs
     */
    public static void validateCount(int pairs, int minimumPairs, String analysis)
            throws ValidationException {
        if (pairs < minimumPairs) {
            logger.warn("{}: {} pairs supplied, {} required", analysis, pairs, minimumPairs);
            throw ValidationException.insufficientData(pairs, minimumPairs, analysis);
        }
    }

    /**
     * Validates a confidence level.
     *
     * @param confidenceLevel the level, e.g. 0.95
     * @throws ValidationException if the level is not strictly between 0 and 1
     */
    public static void validateConfidenceLevel(double confidenceLevel) throws ValidationException {
        if (!(confidenceLevel > 0 && confidenceLevel < 1)) {
            throw ValidationException.invalidParameter("confidenceLevel", confidenceLevel, "in (0, 1)");
        }
    }

    /**
     * Validates a limits of agreement multiplier.
     *
     * @param zMultiplier the SD multiplier
     * @throws ValidationException if the multiplier is not a positive finite number
     */
    public static void validateMultiplier(double zMultiplier) throws ValidationException {
        if (!Double.isFinite(zMultiplier) || zMultiplier <= 0) {
            throw ValidationException.invalidParameter("zMultiplier", zMultiplier, "a positive finite number");
        }
    }
}
