package org.puneet.methcomp.exceptions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serial;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Exception for statistics that cannot be computed from otherwise valid input:
 * an undefined relative difference, a regression with no usable pairwise
 * slope, a confidence interval that cannot be formed, or finite input whose
 * differences, means or sums exceed the double range.
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-02
 */
public class StatisticalValidationException extends ComparisonException {

    @Serial
    private static final long serialVersionUID = 1L;

    private static final Logger logger = LoggerFactory.getLogger(StatisticalValidationException.class);

    /**
     * Types of statistical failures
     */
    public enum StatisticalErrorType {
        DIVISION_BY_ZERO("STAT001", "Relative difference undefined for a zero pair mean"),
        DEGENERATE_REGRESSION("STAT002", "Regression line cannot be estimated"),
        CONFIDENCE_INTERVAL_ERROR("STAT003", "Confidence interval calculation failed"),
        NUMERIC_OVERFLOW("STAT004", "Intermediate value is not a finite double");

        private final String code;
        private final String description;

        StatisticalErrorType(String code, String description) {
            this.code = code;
            this.description = description;
        }

        public String getCode() {
            return code;
        }

        public String getDescription() {
            return description;
        }
    }

    private final StatisticalErrorType errorType;
    private final Integer sampleSize;

    /**
     * Constructs a new StatisticalValidationException with error type and message.
     *
     * @param errorType The type of statistical error
     * @param message The detailed error message
     * @throws NullPointerException if errorType is null
     */
    public StatisticalValidationException(StatisticalErrorType errorType, String message) {
        this(errorType, message, null, null, null);
    }

    /**
     * Constructs a new StatisticalValidationException with error type, message, and cause.
     *
     * @param errorType The type of statistical error
     * @param message The detailed error message
     * @param cause The underlying cause
     * @throws NullPointerException if errorType is null
     */
    public StatisticalValidationException(StatisticalErrorType errorType,
                                          String message, Throwable cause) {
        this(errorType, message, null, null, cause);
    }

    /**
     * Full constructor with all parameters.
     *
     * @param errorType The type of statistical error
     * @param message The detailed error message
     * @param index Index of the offending pair, may be null
     * @param sampleSize Number of pairs analysed, may be null
     * @param cause The underlying cause
     * @throws NullPointerException if errorType is null
     */
    public StatisticalValidationException(StatisticalErrorType errorType, String message,
                                          Integer index, Integer sampleSize, Throwable cause) {
        super(formatMessage(Objects.requireNonNull(errorType, "Error type cannot be null"), message),
                index, cause);
        this.errorType = errorType;
        this.sampleSize = sampleSize;

        logger.debug("StatisticalValidationException created: [{}] {}", errorType.getCode(), getMessage());
    }

    /**
     * Creates an exception for a relative difference over a zero pair mean.
     *
     * @param index index of the pair whose mean is zero
     * @param sampleSize number of pairs in the series
     * @return A new StatisticalValidationException
     */
    public static StatisticalValidationException divisionByZero(int index, int sampleSize) {
        String message = String.format(
                "Pair %d has mean 0; relative differences are undefined and the series is rejected",
                index);
        return new StatisticalValidationException(
                StatisticalErrorType.DIVISION_BY_ZERO, message, index, sampleSize, null);
    }

    /**
     * Creates an exception for a regression with no estimable slope.
     *
     * @param method the regression method
     * @param sampleSize number of pairs analysed
     * @param reason the reason the line is undefined
     * @return A new StatisticalValidationException
     */
    public static StatisticalValidationException degenerateRegression(
            String method, int sampleSize, String reason) {
        String message = String.format("%s over %d pairs: %s", method, sampleSize, reason);
        StatisticalValidationException ex = new StatisticalValidationException(
                StatisticalErrorType.DEGENERATE_REGRESSION, message, null, sampleSize, null);
        ex.addContext("method", method);
        return ex;
    }

    /**
     * Creates an exception for a finite input that overflows during computation.
     *
     * @param analysis the analysis being computed
     * @param quantity the quantity that overflowed, e.g. "difference" or "slope"
     * @param index index of the offending pair, or null for an aggregate
     * @param sampleSize number of pairs analysed
     * @return A new StatisticalValidationException
     */
    public static StatisticalValidationException numericOverflow(
            String analysis, String quantity, Integer index, int sampleSize) {
        String message = index != null
                ? String.format("%s %s of pair %d over %d pairs", analysis, quantity, index, sampleSize)
                : String.format("%s %s over %d pairs", analysis, quantity, sampleSize);
        StatisticalValidationException ex = new StatisticalValidationException(
                StatisticalErrorType.NUMERIC_OVERFLOW, message, index, sampleSize, null);
        ex.addContext("analysis", analysis);
        ex.addContext("quantity", quantity);
        return ex;
    }

    /**
     * Creates an exception for confidence interval calculation errors.
     *
     * @param statistic The statistic the interval belongs to
     * @param confidenceLevel The confidence level
     * @param cause The underlying failure
     * @return A new StatisticalValidationException
     */
    public static StatisticalValidationException confidenceIntervalError(
            String statistic, double confidenceLevel, Throwable cause) {
        String message = String.format(
                "Failed to calculate %.1f%% confidence interval for '%s': %s",
                confidenceLevel * 100, statistic, cause.getMessage());
        StatisticalValidationException ex = new StatisticalValidationException(
                StatisticalErrorType.CONFIDENCE_INTERVAL_ERROR, message, cause);
        ex.addContext("confidenceLevel", confidenceLevel);
        return ex;
    }

    private static String formatMessage(StatisticalErrorType errorType, String message) {
        StringBuilder sb = new StringBuilder();
        sb.append("[").append(errorType.getCode()).append("] ");
        sb.append(errorType.getDescription());

        if (message != null && !message.isEmpty()) {
            sb.append(": ").append(message);
        }

        return sb.toString();
    }

    public StatisticalErrorType getErrorType() {
        return errorType;
    }

    @Override
    public String getCode() {
        return errorType.getCode();
    }

    /**
     * Gets the sample size.
     *
     * @return The sample size, may be null
     */
    public Integer getSampleSize() {
        return sampleSize;
    }

    @Override
    public boolean isCritical() {
        return errorType != StatisticalErrorType.CONFIDENCE_INTERVAL_ERROR;
    }

    /**
     * Gets a detailed message for logging.
     *
     * @return A detailed string representation
     */
    public String getDetailedMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("StatisticalValidationException Details:\n");
        sb.append("  Error Type: ").append(errorType.getCode()).append(" - ")
          .append(errorType.getDescription()).append("\n");
        sb.append("  Message: ").append(getMessage()).append("\n");
        sb.append("  Timestamp: ").append(getTimestamp().format(DateTimeFormatter.ISO_LOCAL_DATE_TIME)).append("\n");

        if (sampleSize != null) {
            sb.append("  Sample Size: ").append(sampleSize).append("\n");
        }

        if (getIndex() != null) {
            sb.append("  Index: ").append(getIndex()).append("\n");
        }

        if (!getContext().isEmpty()) {
            sb.append("  Statistical Context:\n");
            getContext().forEach((key, value) ->
                    sb.append("    ").append(key).append(": ").append(value).append("\n"));
        }

        if (getCause() != null) {
            sb.append("  Cause: ").append(getCause().getClass().getName())
              .append(" - ").append(getCause().getMessage()).append("\n");
        }

        return sb.toString();
    }

    @Override
    public String toString() {
        return String.format("StatisticalValidationException[type=%s, index=%s, timestamp=%s]: %s",
                errorType.getCode(),
                getIndex() != null ? getIndex() : "n/a",
                getTimestamp().format(DateTimeFormatter.ISO_LOCAL_DATE_TIME),
                getMessage());
    }
}
