package org.puneet.methcomp.unit;

import org.junit.jupiter.api.Test;
import org.puneet.methcomp.statistical.DifferenceMode;
import org.puneet.methcomp.util.ComparisonConfig;

import static org.junit.jupiter.api.Assertions.*;

class ComparisonConfigTest {

    @Test
    void testDefaults() {
        ComparisonConfig config = ComparisonConfig.defaults();
        assertEquals(DifferenceMode.ABSOLUTE, config.getDifferenceMode());
        assertEquals(1.96, config.getLimitOfAgreement());
        assertEquals(0.95, config.getConfidenceLevel());
        assertTrue(config.isConfidenceIntervals());
        assertEquals(1.0, config.getVarianceRatio());
        assertEquals(1000, config.getBootstrapIterations());
        assertEquals(123456L, config.getRandomSeed());
        assertEquals(100, config.getMountainPercentiles());
        assertEquals(68.27, config.getMountainCentralRange());
        assertEquals(2000, config.getParallelThreshold());
    }

    @Test
    void testWithersReturnNewInstance() {
        ComparisonConfig base = ComparisonConfig.defaults();
        ComparisonConfig changed = base.withConfidenceLevel(0.90).withDifferenceMode(DifferenceMode.RELATIVE);
        assertNotSame(base, changed);
        assertEquals(0.95, base.getConfidenceLevel());
        assertEquals(0.90, changed.getConfidenceLevel());
        assertEquals(DifferenceMode.RELATIVE, changed.getDifferenceMode());
        assertEquals(base.getLimitOfAgreement(), changed.getLimitOfAgreement());
    }

    @Test
    void testEqualsAndHashCode() {
        ComparisonConfig a = ComparisonConfig.defaults().withBootstrapIterations(10);
        ComparisonConfig b = ComparisonConfig.defaults().withBootstrapIterations(10);
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, ComparisonConfig.defaults());
    }

    @Test
    void testInvalidValuesRejected() {
        ComparisonConfig config = ComparisonConfig.defaults();
        assertThrows(IllegalArgumentException.class, () -> config.withConfidenceLevel(1.0));
        assertThrows(IllegalArgumentException.class, () -> config.withConfidenceLevel(0.0));
        assertThrows(IllegalArgumentException.class, () -> config.withLimitOfAgreement(-1.0));
        assertThrows(IllegalArgumentException.class, () -> config.withVarianceRatio(0.0));
        assertThrows(IllegalArgumentException.class, () -> config.withBootstrapIterations(-1));
        assertThrows(IllegalArgumentException.class, () -> config.withMountainPercentiles(0));
        assertThrows(IllegalArgumentException.class, () -> config.withMountainCentralRange(101));
        assertThrows(IllegalArgumentException.class, () -> config.withParallelThreshold(1));
        assertThrows(NullPointerException.class, () -> config.withDifferenceMode(null));
    }

    @Test
    void testDifferenceModeParsing() {
        assertEquals(DifferenceMode.ABSOLUTE, DifferenceMode.fromString("Absolute"));
        assertEquals(DifferenceMode.RELATIVE, DifferenceMode.fromString("relative"));
        assertEquals(DifferenceMode.RELATIVE, DifferenceMode.fromString(" percentage "));
        assertThrows(IllegalArgumentException.class, () -> DifferenceMode.fromString("ratio"));
        assertThrows(IllegalArgumentException.class, () -> DifferenceMode.fromString(null));
    }

    @Test
    void testToString() {
        String str = ComparisonConfig.defaults().toString();
        assertTrue(str.contains("mode=absolute"));
        assertTrue(str.contains("bootstrap=1000"));
    }
}
