package org.puneet.methcomp.unit;

import org.junit.jupiter.api.Test;
import org.puneet.methcomp.exceptions.StatisticalValidationException;
import org.puneet.methcomp.exceptions.ValidationException;
import org.puneet.methcomp.model.MeasurementSeries;
import org.puneet.methcomp.statistical.BlandAltmanAnalyzer;
import org.puneet.methcomp.statistical.BlandAltmanResult;
import org.puneet.methcomp.statistical.ConfidenceInterval;
import org.puneet.methcomp.statistical.DifferenceMode;
import org.puneet.methcomp.util.ComparisonConfig;

import static org.junit.jupiter.api.Assertions.*;

class BlandAltmanAnalyzerTest {

    private static final double TOLERANCE = 1e-5;

    private static final double[] X = {1, 2, 3, 4, 5};
    private static final double[] Y = {1.1, 2.0, 3.2, 3.9, 5.3};

    private final BlandAltmanAnalyzer analyzer = new BlandAltmanAnalyzer();

    @Test
    void testAbsoluteDifferences() throws Exception {
        BlandAltmanResult result = analyzer.analyze(MeasurementSeries.of(X, Y), ComparisonConfig.defaults());

        assertEquals(5, result.getSampleSize());
        assertArrayEquals(new double[] {0.1, 0.0, 0.2, -0.1, 0.3}, result.getDifferences(), 1e-12);
        assertArrayEquals(new double[] {1.05, 2.0, 3.1, 3.95, 5.15}, result.getMeans(), 1e-12);
        assertEquals(0.1, result.getBias(), 1e-12);
        assertEquals(Math.sqrt(0.025), result.getStandardDeviation(), 1e-12);
        assertEquals(-0.209903, result.getLowerLimit(), TOLERANCE);
        assertEquals(0.409903, result.getUpperLimit(), TOLERANCE);
    }

    @Test
    void testConfidenceIntervals() throws Exception {
        BlandAltmanResult result = analyzer.analyze(MeasurementSeries.of(X, Y), ComparisonConfig.defaults());
        assertTrue(result.hasConfidenceIntervals());

        ConfidenceInterval bias = result.getBiasInterval().orElseThrow();
        assertEquals(0.1 - 0.196324, bias.getLowerBound(), TOLERANCE);
        assertEquals(0.1 + 0.196324, bias.getUpperBound(), TOLERANCE);
        assertTrue(bias.containsZero());

        // standard error of each limit is SD * sqrt(3 / n)
        ConfidenceInterval upper = result.getUpperLimitInterval().orElseThrow();
        assertEquals(0.340043, upper.getWidth() / 2, TOLERANCE);
        assertEquals(result.getUpperLimit(), upper.getEstimate(), 1e-12);
        ConfidenceInterval lower = result.getLowerLimitInterval().orElseThrow();
        assertEquals(upper.getWidth(), lower.getWidth(), 1e-12);
    }

    @Test
    void testIntervalsCanBeDisabled() throws Exception {
        ComparisonConfig config = ComparisonConfig.defaults().withConfidenceIntervals(false);
        BlandAltmanResult result = analyzer.analyze(MeasurementSeries.of(X, Y), config);
        assertFalse(result.hasConfidenceIntervals());
        assertTrue(result.getBiasInterval().isEmpty());
        assertTrue(result.getLowerLimitInterval().isEmpty());
    }

    @Test
    void testAgreementWidthIsTwoZTimesSd() throws Exception {
        ComparisonConfig config = ComparisonConfig.defaults().withLimitOfAgreement(2.5);
        BlandAltmanResult result = analyzer.analyze(MeasurementSeries.of(X, Y), config);
        assertEquals(2 * 2.5 * result.getStandardDeviation(), result.getAgreementWidth(), 1e-12);
        assertTrue(result.getLowerLimit() <= result.getBias());
        assertTrue(result.getBias() <= result.getUpperLimit());
    }

    @Test
    void testSwappingMethodsNegatesBias() throws Exception {
        MeasurementSeries series = MeasurementSeries.of(X, Y);
        BlandAltmanResult forward = analyzer.analyze(series, ComparisonConfig.defaults());
        BlandAltmanResult backward = analyzer.analyze(series.swapped(), ComparisonConfig.defaults());

        assertEquals(-forward.getBias(), backward.getBias(), 1e-12);
        assertEquals(forward.getStandardDeviation(), backward.getStandardDeviation(), 1e-12);
        assertEquals(-forward.getUpperLimit(), backward.getLowerLimit(), 1e-12);
        assertEquals(-forward.getLowerLimit(), backward.getUpperLimit(), 1e-12);
    }

    @Test
    void testRelativeDifferences() throws Exception {
        ComparisonConfig config = ComparisonConfig.defaults().withDifferenceMode(DifferenceMode.RELATIVE);
        BlandAltmanResult result = analyzer.analyze(
            MeasurementSeries.of(new double[] {100, 200}, new double[] {110, 180}), config);

        assertEquals(DifferenceMode.RELATIVE, result.getMode());
        assertEquals(10.0 / 105.0 * 100.0, result.getDifferences()[0], 1e-9);
        assertEquals(-20.0 / 190.0 * 100.0, result.getDifferences()[1], 1e-9);
    }

    @Test
    void testRelativeDifferenceOverZeroMean() throws Exception {
        ComparisonConfig config = ComparisonConfig.defaults().withDifferenceMode(DifferenceMode.RELATIVE);
        MeasurementSeries series = MeasurementSeries.of(new double[] {1, -1, 2}, new double[] {1, 1, 3});

        StatisticalValidationException ex = assertThrows(StatisticalValidationException.class,
            () -> analyzer.analyze(series, config));
        assertEquals(StatisticalValidationException.StatisticalErrorType.DIVISION_BY_ZERO, ex.getErrorType());
        assertEquals(1, ex.getIndex());
    }

    @Test
    void testSinglePairIsInsufficient() throws Exception {
        MeasurementSeries series = MeasurementSeries.of(new double[] {1}, new double[] {2});
        ValidationException ex = assertThrows(ValidationException.class,
            () -> analyzer.analyze(series, ComparisonConfig.defaults()));
        assertEquals(ValidationException.ValidationType.INSUFFICIENT_DATA, ex.getValidationType());
    }

    @Test
    void testIdenticalMethods() throws Exception {
        BlandAltmanResult result = analyzer.analyze(MeasurementSeries.of(X, X), ComparisonConfig.defaults());
        assertEquals(0.0, result.getBias());
        assertEquals(0.0, result.getStandardDeviation());
        assertEquals(0.0, result.getAgreementWidth());
        assertEquals(0.0, result.getBiasInterval().orElseThrow().getWidth());
    }

    @Test
    void testOverflowingDifferenceRejected() throws Exception {
        MeasurementSeries series = MeasurementSeries.of(
            new double[] {-1e308, 1e308, 0}, new double[] {1e308, -1e308, 0});

        for (boolean intervals : new boolean[] {true, false}) {
            StatisticalValidationException ex = assertThrows(StatisticalValidationException.class,
                () -> analyzer.analyze(series, ComparisonConfig.defaults().withConfidenceIntervals(intervals)));
            assertEquals(StatisticalValidationException.StatisticalErrorType.NUMERIC_OVERFLOW, ex.getErrorType());
            assertEquals(0, ex.getIndex());
            assertEquals(3, ex.getSampleSize());
        }
    }

    @Test
    void testOverflowingMomentsRejected() throws Exception {
        MeasurementSeries series = MeasurementSeries.of(
            new double[] {0, 0, 0}, new double[] {1e308, 1.5e308, 1.7e308});

        StatisticalValidationException ex = assertThrows(StatisticalValidationException.class,
            () -> analyzer.analyze(series, ComparisonConfig.defaults().withConfidenceIntervals(false)));
        assertEquals("STAT004", ex.getCode());
        assertNull(ex.getIndex());
    }
}
