package org.puneet.methcomp.unit;

import org.junit.jupiter.api.Test;
import org.puneet.methcomp.exceptions.ValidationException;
import org.puneet.methcomp.exceptions.ValidationException.ValidationType;
import org.puneet.methcomp.util.InputValidator;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InputValidatorTest {

    @Test
    void testValidPairsPass() {
        assertDoesNotThrow(() -> InputValidator.validatePairs(
            new double[] {1, 2, 3}, new double[] {1.1, 2.1, 2.9}, 2, "test"));
    }

    @Test
    void testNullSequence() {
        ValidationException ex = assertThrows(ValidationException.class,
            () -> InputValidator.validatePairs(null, new double[] {1}, 1, "test"));
        assertEquals(ValidationType.NULL_VALUE, ex.getValidationType());
        assertEquals("VAL004", ex.getCode());
    }

    @Test
    void testShapeMismatchReportedBeforeValues() {
        ValidationException ex = assertThrows(ValidationException.class,
            () -> InputValidator.validatePairs(
                new double[] {1, 2, 3, 4, 5}, new double[] {Double.NaN, 2, 3, 4}, 2, "test"));
        assertEquals(ValidationType.SHAPE_MISMATCH, ex.getValidationType());
        assertTrue(ex.getMessage().contains("5"));
        assertTrue(ex.getMessage().contains("4"));
        assertNull(ex.getIndex());
    }

    @Test
    void testNonFiniteValueCarriesIndex() {
        ValidationException ex = assertThrows(ValidationException.class,
            () -> InputValidator.validatePairs(
                new double[] {1, 2, 3}, new double[] {1, Double.POSITIVE_INFINITY, 3}, 2, "test"));
        assertEquals(ValidationType.INVALID_VALUE, ex.getValidationType());
        assertEquals(1, ex.getIndex());
        assertEquals("y", ex.getContext().get("series"));
    }

    @Test
    void testFirstInvalidIndexWins() {
        ValidationException ex = assertThrows(ValidationException.class,
            () -> InputValidator.validatePairs(
                new double[] {1, Double.NaN, 3}, new double[] {1, 2, Double.NaN}, 2, "test"));
        assertEquals(1, ex.getIndex());
        assertEquals("x", ex.getContext().get("series"));
    }

    @Test
    void testInsufficientData() {
        ValidationException ex = assertThrows(ValidationException.class,
            () -> InputValidator.validatePairs(new double[] {1}, new double[] {2}, 2, "Bland-Altman"));
        assertEquals(ValidationType.INSUFFICIENT_DATA, ex.getValidationType());
        assertEquals(1, ex.getContext().get("actualSize"));
        assertEquals(2, ex.getContext().get("requiredSize"));
        assertFalse(ex.isCritical());
    }

    @Test
    void testMissingListElementRejected() {
        List<Double> x = Arrays.asList(1.0, 2.0, 3.0);
        List<Double> y = Arrays.asList(1.0, null, 3.0);
        ValidationException ex = assertThrows(ValidationException.class,
            () -> InputValidator.validatePairs(x, y, 2, "test"));
        assertEquals(ValidationType.INVALID_VALUE, ex.getValidationType());
        assertEquals(1, ex.getIndex());
        assertTrue(ex.getMessage().contains("missing"));
    }

    @Test
    void testConfidenceLevelBounds() {
        assertDoesNotThrow(() -> InputValidator.validateConfidenceLevel(0.95));
        for (double level : new double[] {0.0, 1.0, -0.5, 1.5, Double.NaN}) {
            ValidationException ex = assertThrows(ValidationException.class,
                () -> InputValidator.validateConfidenceLevel(level));
            assertEquals(ValidationType.INVALID_PARAMETER, ex.getValidationType());
        }
    }

    @Test
    void testMultiplierBounds() {
        assertDoesNotThrow(() -> InputValidator.validateMultiplier(1.96));
        assertThrows(ValidationException.class, () -> InputValidator.validateMultiplier(0));
        assertThrows(ValidationException.class, () -> InputValidator.validateMultiplier(-1.96));
        assertThrows(ValidationException.class, () -> InputValidator.validateMultiplier(Double.POSITIVE_INFINITY));
    }
}
