package org.puneet.methcomp.glucose;

import java.util.Locale;

/**
 * Concentration unit of glucose readings. Error grid boundaries are defined
 * in mg/dL and are divided by {@link #getFactor()} for other units.
 */
public enum GlucoseUnit {
    MGDL("mg/dL", 1.0),
    MMOL("mmol/L", 18.0);

    private final String label;
    private final double factor;

    GlucoseUnit(String label, double factor) {
        this.label = label;
        this.factor = factor;
    }

    public String getLabel() {
        return label;
    }

    /** @return mg/dL per unit */
    public double getFactor() {
        return factor;
    }

    /**
     * Parses a unit name: {@code mmol}, {@code mmol/l}, {@code mgdl} or {@code mg/dl}, any case.
     *
     * @param name the unit name
     * @return the unit
     * @throws IllegalArgumentException if the name is not recognised
     */
    public static GlucoseUnit fromString(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Glucose unit cannot be null");
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "mmol", "mmol/l" -> MMOL;
            case "mgdl", "mg/dl" -> MGDL;
            default -> throw new IllegalArgumentException(
                "Unknown glucose unit '" + name + "'; expected mmol, mgdl or mg/dl");
        };
    }
}
