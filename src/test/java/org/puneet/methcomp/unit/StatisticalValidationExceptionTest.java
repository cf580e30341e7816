package org.puneet.methcomp.unit;

import org.junit.jupiter.api.Test;
import org.puneet.methcomp.exceptions.ComparisonException;
import org.puneet.methcomp.exceptions.StatisticalValidationException;
import org.puneet.methcomp.exceptions.StatisticalValidationException.StatisticalErrorType;

import static org.junit.jupiter.api.Assertions.*;

class StatisticalValidationExceptionTest {

    @Test
    void testStatisticalErrorTypeEnum() {
        for (StatisticalErrorType type : StatisticalErrorType.values()) {
            assertNotNull(type.getCode());
            assertNotNull(type.getDescription());
        }
        assertEquals("STAT001", StatisticalErrorType.DIVISION_BY_ZERO.getCode());
        assertEquals("STAT002", StatisticalErrorType.DEGENERATE_REGRESSION.getCode());
    }

    @Test
    void testDivisionByZeroFactory() {
        StatisticalValidationException ex = StatisticalValidationException.divisionByZero(4, 10);
        assertEquals(StatisticalErrorType.DIVISION_BY_ZERO, ex.getErrorType());
        assertEquals(4, ex.getIndex());
        assertEquals(10, ex.getSampleSize());
        assertTrue(ex.isCritical());
        assertTrue(ex.getDetailedMessage().contains("Sample Size: 10"));
    }

    @Test
    void testDegenerateRegressionFactory() {
        StatisticalValidationException ex =
            StatisticalValidationException.degenerateRegression("Passing-Bablok", 3, "no slope");
        assertEquals("STAT002", ex.getCode());
        assertEquals("Passing-Bablok", ex.getContext().get("method"));
        assertNull(ex.getIndex());
        assertTrue(ex.getMessage().contains("no slope"));
    }

    @Test
    void testConfidenceIntervalErrorFactory() {
        IllegalArgumentException cause = new IllegalArgumentException("df must be positive");
        StatisticalValidationException ex =
            StatisticalValidationException.confidenceIntervalError("bias", 0.95, cause);
        assertSame(cause, ex.getCause());
        assertFalse(ex.isCritical());
        assertTrue(ex.getMessage().contains("95.0%"));
        assertTrue(ex.getDetailedMessage().contains("df must be positive"));
    }

    @Test
    void testCommonBase() {
        ComparisonException ex = StatisticalValidationException.divisionByZero(0, 2);
        assertEquals("STAT001", ex.getCode());
        ex.addContext("extra", 1);
        assertEquals(1, ex.getContext().get("extra"));
    }

    @Test
    void testToString() {
        StatisticalValidationException ex = new StatisticalValidationException(
            StatisticalErrorType.DEGENERATE_REGRESSION, "flat");
        String str = ex.toString();
        assertTrue(str.contains("StatisticalValidationException"));
        assertTrue(str.contains("STAT002"));
    }

    @Test
    void testNumericOverflowFactory() {
        StatisticalValidationException ex =
            StatisticalValidationException.numericOverflow("Bland-Altman", "difference", 2, 7);
        assertEquals(StatisticalErrorType.NUMERIC_OVERFLOW, ex.getErrorType());
        assertEquals("STAT004", ex.getCode());
        assertEquals(2, ex.getIndex());
        assertEquals(7, ex.getSampleSize());
        assertTrue(ex.isCritical());
        assertEquals("difference", ex.getContext().get("quantity"));
        assertTrue(ex.getMessage().contains("pair 2"));

        StatisticalValidationException aggregate =
            StatisticalValidationException.numericOverflow("Deming", "error variance", null, 4);
        assertNull(aggregate.getIndex());
        assertTrue(aggregate.getDetailedMessage().contains("Sample Size: 4"));
    }
}
