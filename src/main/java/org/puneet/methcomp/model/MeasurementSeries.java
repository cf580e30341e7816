package org.puneet.methcomp.model;

import org.puneet.methcomp.exceptions.ValidationException;
import org.puneet.methcomp.util.InputValidator;

import java.util.AbstractList;
import java.util.Arrays;
import java.util.List;

/**
 * Ordered, index-aligned pairs from one comparison run. Pair {@code i} is
 * {@code (x[i], y[i])}; the index is the only thing that establishes pairing,
 * so order is preserved exactly as supplied.
 *
 * <p>Immutable: the input arrays are copied on construction and every
 * accessor returns a copy.</p>
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-02
 */
public final class MeasurementSeries {

    private final double[] x;
    private final double[] y;

    private MeasurementSeries(double[] x, double[] y) {
        this.x = x;
        this.y = y;
    }

    /**
     * Builds a series from two index-aligned arrays.
     *
     * @param x method 1 values
     * @param y method 2 values
     * @return the series
     * @throws ValidationException if the arrays are null, differ in length,
     *         contain a non-finite value, or are empty
     */
    public static MeasurementSeries of(double[] x, double[] y) throws ValidationException {
        InputValidator.validatePairs(x, y, 1, "MeasurementSeries");
        return new MeasurementSeries(x.clone(), y.clone());
    }

    /**
     * Builds a series from two index-aligned lists; a null element is a
     * missing measurement and is rejected with its index.
     *
     * @param x method 1 values
     * @param y method 2 values
     * @return the series
     * @throws ValidationException on the first failed check
     */
    public static MeasurementSeries of(List<Double> x, List<Double> y) throws ValidationException {
        InputValidator.validatePairs(x, y, 1, "MeasurementSeries");
        return new MeasurementSeries(
            x.stream().mapToDouble(Double::doubleValue).toArray(),
            y.stream().mapToDouble(Double::doubleValue).toArray());
    }

    public int size() {
        return x.length;
    }

    public MeasurementPair get(int index) {
        return new MeasurementPair(x[index], y[index]);
    }

    public double x(int index) {
        return x[index];
    }

    public double y(int index) {
        return y[index];
    }

    public double[] xValues() {
        return x.clone();
    }

    public double[] yValues() {
        return y.clone();
    }

    /**
     * @return an unmodifiable view of the pairs
     */
    public List<MeasurementPair> pairs() {
        return new AbstractList<>() {
            @Override
            public MeasurementPair get(int index) {
                return MeasurementSeries.this.get(index);
            }

            @Override
            public int size() {
                return x.length;
            }
        };
    }

    /**
     * @return the same pairs with method 1 and method 2 exchanged
     */
    public MeasurementSeries swapped() {
        return new MeasurementSeries(y.clone(), x.clone());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MeasurementSeries)) return false;
        MeasurementSeries other = (MeasurementSeries) o;
        return Arrays.equals(x, other.x) && Arrays.equals(y, other.y);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(x) + Arrays.hashCode(y);
    }

    @Override
    public String toString() {
        return "MeasurementSeries[n=" + x.length + "]";
    }
}
