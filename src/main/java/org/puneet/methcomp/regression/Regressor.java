package org.puneet.methcomp.regression;

import org.puneet.methcomp.exceptions.StatisticalValidationException;
import org.puneet.methcomp.exceptions.ValidationException;
import org.puneet.methcomp.model.MeasurementSeries;
import org.puneet.methcomp.util.ComparisonConfig;

/**
 * A method comparison regression. Implementations are stateless and
 * thread-safe; each call to {@link #fit} is independent.
 *
 * @param <R> the result type
 */
public interface Regressor<R extends RegressionResult> {

    /**
     * @return the method name used in results and logs
     */
    String getName();

    /**
     * Fits the regression line of method 2 on method 1.
     *
     * @param series the paired measurements
     * @param config analysis options
     * @return the fitted line with its intervals
     * @throws ValidationException if the series has too few pairs or an option is invalid
     * @throws StatisticalValidationException if the line is undefined for this data
     *         or an intermediate value overflows
     */
    R fit(MeasurementSeries series, ComparisonConfig config)
        throws ValidationException, StatisticalValidationException;
}
