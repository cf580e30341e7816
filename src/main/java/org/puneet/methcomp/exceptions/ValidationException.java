package org.puneet.methcomp.exceptions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serial;
import java.io.Serializable;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Input validation exception for the method comparison engine.
 * Raised once at entry, before any numeric work, when the paired sequences
 * or the analysis parameters violate a precondition.
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-02
 */
public class ValidationException extends ComparisonException {

    @Serial
    private static final long serialVersionUID = 1L;

    private static final Logger logger = LoggerFactory.getLogger(ValidationException.class);

    /**
     * Types of validation failures
     */
    public enum ValidationType {
        SHAPE_MISMATCH("VAL001", "Paired sequences differ in length"),
        INVALID_VALUE("VAL002", "Non-finite or missing measurement value"),
        INSUFFICIENT_DATA("VAL003", "Too few pairs for the requested statistic"),
        NULL_VALUE("VAL004", "Null value not allowed"),
        INVALID_PARAMETER("VAL005", "Analysis parameter out of valid range");

        private final String code;
        private final String description;

        ValidationType(String code, String description) {
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

    /**
     * Validation error details
     */
    public static class ValidationError implements Serializable {
        @Serial
        private static final long serialVersionUID = 1L;

        private final String fieldName;
        private final Object actualValue;
        private final Object expectedValue;
        private final String constraint;

        public ValidationError(String fieldName, Object actualValue,
                               Object expectedValue, String constraint) {
            this.fieldName = fieldName;
            this.actualValue = actualValue;
            this.expectedValue = expectedValue;
            this.constraint = constraint;
        }

        public String getFieldName() {
            return fieldName;
        }

        public Object getActualValue() {
            return actualValue;
        }

        public Object getExpectedValue() {
            return expectedValue;
        }

        public String getConstraint() {
            return constraint;
        }

        @Override
        public String toString() {
            return String.format("Field '%s': expected %s %s, but got %s",
                    fieldName, constraint, expectedValue, actualValue);
        }
    }

    private final ValidationType validationType;
    private final List<ValidationError> validationErrors;

    /**
     * Constructs a new ValidationException with type and message.
     *
     * @param validationType The type of validation that failed
     * @param message The detailed error message
     * @throws NullPointerException if validationType is null
     */
    public ValidationException(ValidationType validationType, String message) {
        this(validationType, message, null, new ArrayList<>());
    }

    /**
     * Constructs a new ValidationException with all parameters.
     *
     * @param validationType The type of validation that failed
     * @param message The detailed error message
     * @param index Index of the offending pair, may be null
     * @param validationErrors List of specific validation errors
     * @throws NullPointerException if validationType is null
     */
    public ValidationException(ValidationType validationType, String message,
                               Integer index, List<ValidationError> validationErrors) {
        super(formatMessage(Objects.requireNonNull(validationType, "Validation type cannot be null"),
                message, validationErrors), index, null);
        this.validationType = validationType;
        this.validationErrors = validationErrors != null
                ? new ArrayList<>(validationErrors) : new ArrayList<>();

        logger.debug("ValidationException created: [{}] {}", validationType.getCode(), getMessage());
    }

    /**
     * Creates an exception for two sequences of different length.
     *
     * @param xLength length of the method 1 sequence
     * @param yLength length of the method 2 sequence
     * @return A new ValidationException
     */
    public static ValidationException shapeMismatch(int xLength, int yLength) {
        String message = String.format(
                "Method 1 has %d values but method 2 has %d", xLength, yLength);
        List<ValidationError> errors = List.of(
                new ValidationError("y.length", yLength, xLength, "==")
        );
        ValidationException ex = new ValidationException(
                ValidationType.SHAPE_MISMATCH, message, null, errors);
        ex.addContext("xLength", xLength);
        ex.addContext("yLength", yLength);
        return ex;
    }

    /**
     * Creates an exception for a non-finite or missing element.
     *
     * @param series the series holding the element ("x" or "y")
     * @param index index of the offending element
     * @param value the offending value, null when missing
     * @return A new ValidationException
     */
    public static ValidationException invalidValue(String series, int index, Double value) {
        String message = String.format(
                "%s[%d] is %s; every measurement must be a finite number",
                series, index, value == null ? "missing" : value);
        List<ValidationError> errors = List.of(
                new ValidationError(series + "[" + index + "]", value, "finite", "IS")
        );
        ValidationException ex = new ValidationException(
                ValidationType.INVALID_VALUE, message, index, errors);
        ex.addContext("series", series);
        return ex;
    }

    /**
     * Creates an exception for too few pairs.
     *
     * @param actual the number of pairs supplied
     * @param required the minimum number of pairs
     * @param analysis the analysis requiring the pairs
     * @return A new ValidationException
     */
    public static ValidationException insufficientData(int actual, int required, String analysis) {
        String message = String.format(
                "%s needs at least %d pairs, got %d", analysis, required, actual);
        List<ValidationError> errors = List.of(
                new ValidationError("pairs", actual, required, ">=")
        );
        ValidationException ex = new ValidationException(
                ValidationType.INSUFFICIENT_DATA, message, null, errors);
        ex.addContext("actualSize", actual);
        ex.addContext("requiredSize", required);
        ex.addContext("analysis", analysis);
        return ex;
    }

    /**
     * Creates a validation exception for null value scenarios.
     *
     * @param fieldName The name of the field that is null
     * @return A new ValidationException configured for null validation
     */
    public static ValidationException nullValue(String fieldName) {
        String message = String.format("Null value not allowed for field '%s'", fieldName);
        List<ValidationError> errors = List.of(
                new ValidationError(fieldName, null, "non-null", "NOT_NULL")
        );
        return new ValidationException(ValidationType.NULL_VALUE, message, null, errors);
    }

    /**
     * Creates an exception for an analysis parameter outside its range.
     *
     * @param parameter the parameter name
     * @param value the rejected value
     * @param constraint human readable constraint, e.g. "in (0, 1)"
     * @return A new ValidationException
     */
    public static ValidationException invalidParameter(String parameter, Object value, String constraint) {
        String message = String.format("%s must be %s, got %s", parameter, constraint, value);
        List<ValidationError> errors = List.of(
                new ValidationError(parameter, value, constraint, "RANGE")
        );
        return new ValidationException(ValidationType.INVALID_PARAMETER, message, null, errors);
    }

    private static String formatMessage(ValidationType type, String message,
                                        List<ValidationError> errors) {
        StringBuilder sb = new StringBuilder();
        sb.append("[").append(type.getCode()).append("] ");
        sb.append(type.getDescription());

        if (message != null && !message.isEmpty()) {
            sb.append(": ").append(message);
        }

        if (errors != null && errors.size() > 1) {
            sb.append(" (").append(errors.size()).append(" errors)");
        }

        return sb.toString();
    }

    public ValidationType getValidationType() {
        return validationType;
    }

    @Override
    public String getCode() {
        return validationType.getCode();
    }

    /**
     * Gets the validation errors.
     *
     * @return An unmodifiable list of validation errors
     */
    public List<ValidationError> getValidationErrors() {
        return Collections.unmodifiableList(validationErrors);
    }

    @Override
    public boolean isCritical() {
        return switch (validationType) {
            case SHAPE_MISMATCH, INVALID_VALUE, NULL_VALUE -> true;
            default -> false;
        };
    }

    /**
     * Gets a detailed message for logging.
     *
     * @return A detailed string representation
     */
    public String getDetailedMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("ValidationException Details:\n");
        sb.append("  Type: ").append(validationType.getCode()).append(" - ")
          .append(validationType.getDescription()).append("\n");
        sb.append("  Message: ").append(getMessage()).append("\n");
        sb.append("  Timestamp: ").append(getTimestamp().format(DateTimeFormatter.ISO_LOCAL_DATE_TIME)).append("\n");

        if (getIndex() != null) {
            sb.append("  Index: ").append(getIndex()).append("\n");
        }

        if (!validationErrors.isEmpty()) {
            sb.append("  Errors:\n");
            validationErrors.forEach(e -> sb.append("    ").append(e).append("\n"));
        }

        if (!getContext().isEmpty()) {
            sb.append("  Context:\n");
            getContext().forEach((key, value) ->
                    sb.append("    ").append(key).append(": ").append(value).append("\n"));
        }

        return sb.toString();
    }

    @Override
    public String toString() {
        return String.format("ValidationException[type=%s, index=%s]: %s",
                validationType.name(),
                getIndex() != null ? getIndex() : "n/a",
                getMessage());
    }
}
