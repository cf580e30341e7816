package org.puneet.methcomp.exceptions;

import java.io.Serial;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Common base of every failure reported by the method comparison engine.
 * A caller receives either a fully populated result or one of these, carrying
 * a stable error code and, where one input element triggered the failure,
 * its index.
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-02
 */
public abstract class ComparisonException extends Exception {

    @Serial
    private static final long serialVersionUID = 1L;

    private final LocalDateTime timestamp;
    private final Integer index;
    private final Map<String, Object> context;

    protected ComparisonException(String message, Integer index, Throwable cause) {
        super(message, cause);
        this.timestamp = LocalDateTime.now();
        this.index = index;
        this.context = new HashMap<>();
    }

    /**
     * Gets the stable error code (e.g. {@code VAL001}).
     *
     * @return the error code
     */
    public abstract String getCode();

    /**
     * Checks whether the failure invalidates any statistic computed from the same input.
     *
     * @return true if critical
     */
    public abstract boolean isCritical();

    /**
     * Gets the index of the offending pair.
     *
     * @return the index, may be null when the failure is not tied to one element
     */
    public Integer getIndex() {
        return index;
    }

    public LocalDateTime getTimestamp() {
        return timestamp;
    }

    /**
     * Adds context information.
     *
     * @param key the context key
     * @param value the context value
     */
    public void addContext(String key, Object value) {
        if (key != null) {
            context.put(key, value);
        }
    }

    public Map<String, Object> getContext() {
        return Collections.unmodifiableMap(context);
    }
}
