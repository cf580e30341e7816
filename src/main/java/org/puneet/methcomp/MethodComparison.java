package org.puneet.methcomp;

import org.puneet.methcomp.exceptions.StatisticalValidationException;
import org.puneet.methcomp.exceptions.ValidationException;
import org.puneet.methcomp.glucose.ClarkeErrorGrid;
import org.puneet.methcomp.glucose.ClarkeErrorGridResult;
import org.puneet.methcomp.glucose.DiabetesType;
import org.puneet.methcomp.glucose.GlucoseUnit;
import org.puneet.methcomp.glucose.ParkesErrorGrid;
import org.puneet.methcomp.glucose.ParkesErrorGridResult;
import org.puneet.methcomp.model.MeasurementSeries;
import org.puneet.methcomp.regression.DemingRegression;
import org.puneet.methcomp.regression.DemingResult;
import org.puneet.methcomp.regression.LinearRegression;
import org.puneet.methcomp.regression.PassingBablokEstimator;
import org.puneet.methcomp.regression.PassingBablokResult;
import org.puneet.methcomp.regression.RegressionResult;
import org.puneet.methcomp.statistical.BlandAltmanAnalyzer;
import org.puneet.methcomp.statistical.BlandAltmanResult;
import org.puneet.methcomp.statistical.DifferenceMode;
import org.puneet.methcomp.statistical.MountainAnalyzer;
import org.puneet.methcomp.statistical.MountainResult;
import org.puneet.methcomp.util.ComparisonConfig;
import org.puneet.methcomp.util.ComparisonConfigLoader;
import org.puneet.methcomp.util.InputValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Entry point for comparing two measurement methods on paired samples.
 *
 * <p>Each call validates its raw input, builds a {@link MeasurementSeries} and
 * runs one analysis with the configuration it was given. Overloads without a
 * configuration use {@link ComparisonConfig#defaults()}, never the classpath
 * file, so every call depends on its arguments only. All methods are safe to
 * call concurrently.</p>
 *
 * <pre>{@code
 * BlandAltmanResult ba = MethodComparison.blandAltman(method1, method2);
 * PassingBablokResult pb = MethodComparison.passingBablok(method1, method2, 0.95);
 * }</pre>
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-04
 */
public final class MethodComparison {
    private static final Logger logger = LoggerFactory.getLogger(MethodComparison.class);

    private static final BlandAltmanAnalyzer BLAND_ALTMAN = new BlandAltmanAnalyzer();
    private static final PassingBablokEstimator PASSING_BABLOK = new PassingBablokEstimator();
    private static final DemingRegression DEMING = new DemingRegression();
    private static final LinearRegression LINEAR = new LinearRegression();
    private static final MountainAnalyzer MOUNTAIN = new MountainAnalyzer();

    private MethodComparison() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Loads the defaults from {@value ComparisonConfigLoader#CONFIG_FILE} on the classpath.
     *
     * @return the configuration
     * @throws IllegalStateException if the file is missing or unreadable
     */
    public static ComparisonConfig defaultConfig() {
        return new ComparisonConfigLoader().load();
    }

    // Bland-Altman

    public static BlandAltmanResult blandAltman(double[] x, double[] y)
            throws ValidationException, StatisticalValidationException {
        return blandAltman(x, y, ComparisonConfig.defaults());
    }

    public static BlandAltmanResult blandAltman(double[] x, double[] y, ComparisonConfig config)
            throws ValidationException, StatisticalValidationException {
        Objects.requireNonNull(config, "Config cannot be null");
        return BLAND_ALTMAN.analyze(series(x, y, InputValidator.MIN_PAIRS, "Bland-Altman"), config);
    }

    /**
     * Bland-Altman analysis with explicit scalar options and confidence intervals.
     *
     * @param x method 1 values
     * @param y method 2 values
     * @param mode absolute or relative differences
     * @param zMultiplier SD multiplier of the limits of agreement
     * @param confidenceLevel level of the intervals, in (0, 1)
     * @return the analysis
     * @throws ValidationException on invalid input or options
     * @throws StatisticalValidationException if a relative difference divides by zero
     */
    public static BlandAltmanResult blandAltman(double[] x, double[] y, DifferenceMode mode,
                                                double zMultiplier, double confidenceLevel)
            throws ValidationException, StatisticalValidationException {
        if (mode == null) {
            throw ValidationException.nullValue("mode");
        }
        InputValidator.validateMultiplier(zMultiplier);
        InputValidator.validateConfidenceLevel(confidenceLevel);
        ComparisonConfig config = ComparisonConfig.defaults()
            .withDifferenceMode(mode)
            .withLimitOfAgreement(zMultiplier)
            .withConfidenceLevel(confidenceLevel)
            .withConfidenceIntervals(true);
        return blandAltman(x, y, config);
    }

    // Passing-Bablok

    public static PassingBablokResult passingBablok(double[] x, double[] y)
            throws ValidationException, StatisticalValidationException {
        return passingBablok(x, y, ComparisonConfig.defaults());
    }

    public static PassingBablokResult passingBablok(double[] x, double[] y, double confidenceLevel)
            throws ValidationException, StatisticalValidationException {
        InputValidator.validateConfidenceLevel(confidenceLevel);
        return passingBablok(x, y, ComparisonConfig.defaults().withConfidenceLevel(confidenceLevel));
    }

    public static PassingBablokResult passingBablok(double[] x, double[] y, ComparisonConfig config)
            throws ValidationException, StatisticalValidationException {
        Objects.requireNonNull(config, "Config cannot be null");
        return PASSING_BABLOK.fit(series(x, y, InputValidator.MIN_PAIRS, PassingBablokEstimator.METHOD), config);
    }

    // Supplementary analyses

    public static DemingResult deming(double[] x, double[] y, ComparisonConfig config)
            throws ValidationException, StatisticalValidationException {
        Objects.requireNonNull(config, "Config cannot be null");
        return DEMING.fit(series(x, y, DemingRegression.MIN_PAIRS, DemingRegression.METHOD), config);
    }

    public static RegressionResult linear(double[] x, double[] y, ComparisonConfig config)
            throws ValidationException, StatisticalValidationException {
        Objects.requireNonNull(config, "Config cannot be null");
        return LINEAR.fit(series(x, y, LinearRegression.MIN_PAIRS, LinearRegression.METHOD), config);
    }

    public static MountainResult mountain(double[] x, double[] y, ComparisonConfig config)
            throws ValidationException, StatisticalValidationException {
        Objects.requireNonNull(config, "Config cannot be null");
        return MOUNTAIN.analyze(series(x, y, 1, "Mountain"), config);
    }

    /**
     * Clarke error grid classification.
     *
     * @param reference reference method readings, all positive
     * @param test test method readings
     * @param unit unit of both series
     * @return zones per pair and totals
     * @throws ValidationException on invalid input or a non-positive reference
     */
    public static ClarkeErrorGridResult clarke(double[] reference, double[] test, GlucoseUnit unit)
            throws ValidationException {
        if (unit == null) {
            throw ValidationException.nullValue("unit");
        }
        return new ClarkeErrorGrid(unit).classify(series(reference, test, 1, "Clarke error grid"));
    }

    /**
     * Parkes consensus error grid classification.
     *
     * @param reference reference method readings, not negative
     * @param test test method readings, not negative
     * @param unit unit of both series
     * @param type diabetes type whose grid is used
     * @return zones per pair and totals
     * @throws ValidationException on invalid input or a negative reading
     */
    public static ParkesErrorGridResult parkes(double[] reference, double[] test, GlucoseUnit unit,
                                               DiabetesType type) throws ValidationException {
        if (unit == null) {
            throw ValidationException.nullValue("unit");
        }
        if (type == null) {
            throw ValidationException.nullValue("type");
        }
        return new ParkesErrorGrid(type, unit).classify(series(reference, test, 1, "Parkes error grid"));
    }

    private static MeasurementSeries series(double[] x, double[] y, int minimumPairs, String analysis)
            throws ValidationException {
        InputValidator.validatePairs(x, y, minimumPairs, analysis);
        logger.debug("{}: {} pairs accepted", analysis, x.length);
        return MeasurementSeries.of(x, y);
    }
}
