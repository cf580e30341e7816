package org.puneet.methcomp.unit;

import org.junit.jupiter.api.Test;
import org.puneet.methcomp.exceptions.StatisticalValidationException;
import org.puneet.methcomp.model.MeasurementSeries;
import org.puneet.methcomp.statistical.MountainAnalyzer;
import org.puneet.methcomp.statistical.MountainResult;
import org.puneet.methcomp.util.ComparisonConfig;

import static org.junit.jupiter.api.Assertions.*;

class MountainAnalyzerTest {

    private static final double[] ZEROS = {0, 0, 0, 0, 0};
    private static final double[] ONE_TO_FIVE = {1, 2, 3, 4, 5};

    private final MountainAnalyzer analyzer = new MountainAnalyzer();

    @Test
    void testFiveGridPoints() throws Exception {
        ComparisonConfig config = ComparisonConfig.defaults().withMountainPercentiles(5);
        MountainResult result = analyzer.analyze(MeasurementSeries.of(ZEROS, ONE_TO_FIVE), config);

        assertArrayEquals(new double[] {1, 2, 3, 4, 5}, result.getQuantiles(), 1e-12);
        assertArrayEquals(new double[] {0, 25, 50, 25, 0}, result.getFoldedCdf(), 1e-12);
        assertEquals(100.0, result.getAreaUnderCurve(), 1e-9);
        assertEquals(2, result.getMedianIndex());
        assertEquals(3.0, result.getMedian(), 1e-12);
    }

    @Test
    void testCentralRange() throws Exception {
        ComparisonConfig config = ComparisonConfig.defaults().withMountainPercentiles(5);
        MountainResult result = analyzer.analyze(MeasurementSeries.of(ZEROS, ONE_TO_FIVE), config);

        assertEquals(68.27, result.getCentralRange());
        assertEquals(1.6346, result.getCentralLower(), 1e-9);
        assertEquals(4.3654, result.getCentralUpper(), 1e-9);
        assertEquals(1, result.getCentralLowerIndex());
        assertEquals(3, result.getCentralUpperIndex());
        assertEquals(2.7308, result.getCentralWidth(), 1e-9);
    }

    @Test
    void testAreaApproachesMeanAbsoluteDeviation() throws Exception {
        ComparisonConfig config = ComparisonConfig.defaults().withMountainPercentiles(1001);
        MountainResult result = analyzer.analyze(MeasurementSeries.of(ZEROS, ONE_TO_FIVE), config);
        // differences spread uniformly over [1, 5] deviate from 3 by 1 on average
        assertEquals(100.0, result.getAreaUnderCurve(), 1e-6);
        assertEquals(1001, result.getQuantiles().length);
    }

    @Test
    void testSingleGridPoint() throws Exception {
        ComparisonConfig config = ComparisonConfig.defaults().withMountainPercentiles(1);
        MountainResult result = analyzer.analyze(MeasurementSeries.of(ZEROS, ONE_TO_FIVE), config);
        assertArrayEquals(new double[] {1}, result.getQuantiles());
        assertArrayEquals(new double[] {0}, result.getFoldedCdf());
        assertEquals(0.0, result.getAreaUnderCurve());
    }

    @Test
    void testFoldedCurvePeaksAtFifty() throws Exception {
        MountainResult result = analyzer.analyze(
            MeasurementSeries.of(ONE_TO_FIVE, new double[] {1.2, 1.9, 3.3, 4.1, 4.8}), ComparisonConfig.defaults());
        double[] folded = result.getFoldedCdf();
        assertEquals(100, folded.length);
        for (double value : folded) {
            assertTrue(value >= 0 && value <= 50);
        }
        double[] quantiles = result.getQuantiles();
        for (int i = 1; i < quantiles.length; i++) {
            assertTrue(quantiles[i - 1] <= quantiles[i]);
        }
    }

    @Test
    void testSinglePair() throws Exception {
        MountainResult result = analyzer.analyze(
            MeasurementSeries.of(new double[] {1}, new double[] {3}), ComparisonConfig.defaults());
        assertEquals(2.0, result.getMedian());
        assertEquals(0.0, result.getAreaUnderCurve());
    }

    @Test
    void testOverflowingDifferenceRejected() throws Exception {
        MeasurementSeries series = MeasurementSeries.of(new double[] {0, 1e308}, new double[] {1, -1e308});
        StatisticalValidationException ex = assertThrows(StatisticalValidationException.class,
            () -> analyzer.analyze(series, ComparisonConfig.defaults()));
        assertEquals("STAT004", ex.getCode());
        assertEquals(1, ex.getIndex());
    }

    @Test
    void testCurveFollowsMethodTwoMinusMethodOne() throws Exception {
        MeasurementSeries series = MeasurementSeries.of(new double[] {1, 2, 3}, new double[] {3, 4, 5});
        MountainResult forward = analyzer.analyze(series, ComparisonConfig.defaults());
        MountainResult mirrored = analyzer.analyze(series.swapped(), ComparisonConfig.defaults());

        assertEquals(2.0, forward.getMedian(), 1e-12);
        assertEquals(-2.0, mirrored.getMedian(), 1e-12);
    }
}
