package org.puneet.methcomp.glucose;

/**
 * Patient population of a Parkes error grid. Each type has its own zone
 * boundaries.
 */
public enum DiabetesType {
    TYPE_1(1, "Type 1 diabetes"),
    TYPE_2(2, "Type 2 diabetes");

    private final int number;
    private final String label;

    DiabetesType(int number, String label) {
        this.number = number;
        this.label = label;
    }

    public int getNumber() {
        return number;
    }

    public String getLabel() {
        return label;
    }

    /**
     * @param number 1 or 2
     * @return the type
     * @throws IllegalArgumentException for any other number
     */
    public static DiabetesType fromNumber(int number) {
        return switch (number) {
            case 1 -> TYPE_1;
            case 2 -> TYPE_2;
            default -> throw new IllegalArgumentException(
                "Type of diabetes should be 1 or 2, got " + number);
        };
    }
}
