package org.puneet.methcomp.model;

/**
 * Two readings of the same subject, by method 1 ({@code x}) and method 2 ({@code y}).
 */
public final class MeasurementPair {

    private final double x;
    private final double y;

    /**
     * Creates a pair.
     *
     * @param x method 1 value
     * @param y method 2 value
     * @throws IllegalArgumentException if either value is not finite
     */
    public MeasurementPair(double x, double y) {
        if (!Double.isFinite(x) || !Double.isFinite(y)) {
            throw new IllegalArgumentException("Measurement values must be finite, got (" + x + ", " + y + ")");
        }
        this.x = x;
        this.y = y;
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    public double mean() {
        return (x + y) / 2.0;
    }

    /**
     * @return {@code y - x}
     */
    public double difference() {
        return y - x;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MeasurementPair)) return false;
        MeasurementPair other = (MeasurementPair) o;
        return Double.compare(x, other.x) == 0 && Double.compare(y, other.y) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * Double.hashCode(x) + Double.hashCode(y);
    }

    @Override
    public String toString() {
        return "(" + x + ", " + y + ")";
    }
}
