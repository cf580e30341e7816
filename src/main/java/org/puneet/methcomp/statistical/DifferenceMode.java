package org.puneet.methcomp.statistical;

import java.util.Locale;

/**
 * How the per-pair difference of a Bland-Altman analysis is expressed.
 */
public enum DifferenceMode {
    /** {@code y - x} in measurement units. */
    ABSOLUTE("absolute"),
    /** {@code (y - x) / mean * 100}, percent of the pair mean. */
    RELATIVE("relative");

    private final String displayName;

    DifferenceMode(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Parses a mode name. Accepts {@code "percentage"} as an alias of {@link #RELATIVE}.
     *
     * @param value the mode name, case insensitive
     * @return the mode
     * @throws IllegalArgumentException if the name is unknown
     */
    public static DifferenceMode fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Difference mode cannot be null");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "absolute" -> ABSOLUTE;
            case "relative", "percentage" -> RELATIVE;
            default -> throw new IllegalArgumentException(
                "Difference mode must be absolute, relative or percentage, got: " + value);
        };
    }
}
