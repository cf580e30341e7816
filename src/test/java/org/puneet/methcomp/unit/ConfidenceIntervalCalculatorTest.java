package org.puneet.methcomp.unit;

import org.junit.jupiter.api.Test;
import org.puneet.methcomp.statistical.ConfidenceInterval;
import org.puneet.methcomp.statistical.ConfidenceIntervalCalculator;

import static org.junit.jupiter.api.Assertions.*;

class ConfidenceIntervalCalculatorTest {

    private static final double TOLERANCE = 1e-5;

    @Test
    void testCriticalValues() {
        assertEquals(2.776445, ConfidenceIntervalCalculator.tCritical(4, 0.95), TOLERANCE);
        assertEquals(12.706205, ConfidenceIntervalCalculator.tCritical(1, 0.95), TOLERANCE);
        assertEquals(1.959964, ConfidenceIntervalCalculator.zCritical(0.95), TOLERANCE);
        assertEquals(1.644854, ConfidenceIntervalCalculator.zCritical(0.90), TOLERANCE);
    }

    @Test
    void testCriticalValueArguments() {
        assertThrows(IllegalArgumentException.class, () -> ConfidenceIntervalCalculator.tCritical(0, 0.95));
        assertThrows(IllegalArgumentException.class, () -> ConfidenceIntervalCalculator.tCritical(5, 1.0));
        assertThrows(IllegalArgumentException.class, () -> ConfidenceIntervalCalculator.zCritical(0.0));
    }

    @Test
    void testValueAtRankClamps() {
        double[] sorted = {1, 2, 3, 4};
        assertEquals(1.0, ConfidenceIntervalCalculator.valueAtRank(sorted, -3));
        assertEquals(3.0, ConfidenceIntervalCalculator.valueAtRank(sorted, 2));
        assertEquals(4.0, ConfidenceIntervalCalculator.valueAtRank(sorted, 10));
        assertEquals(0, ConfidenceIntervalCalculator.clampIndex(4, Long.MIN_VALUE));
        assertThrows(IllegalArgumentException.class, () -> ConfidenceIntervalCalculator.clampIndex(0, 0));
    }

    @Test
    void testMedian() {
        assertEquals(2.0, ConfidenceIntervalCalculator.median(new double[] {3, 1, 2}));
        assertEquals(2.5, ConfidenceIntervalCalculator.median(new double[] {4, 1, 3, 2}));
    }

    @Test
    void testSymmetricAndOrdered() {
        ConfidenceInterval symmetric = ConfidenceIntervalCalculator.symmetric(1.0, 0.5, 0.25, 0.95, 10, "t");
        assertEquals(0.5, symmetric.getLowerBound());
        assertEquals(1.5, symmetric.getUpperBound());
        assertEquals(0.25, symmetric.getStandardError());

        ConfidenceInterval ordered = ConfidenceIntervalCalculator.ordered(1.0, 2.0, 0.5, 0.95, 10, "Rank");
        assertEquals(0.5, ordered.getLowerBound());
        assertEquals(2.0, ordered.getUpperBound());
        assertTrue(Double.isNaN(ordered.getStandardError()));
    }
}
