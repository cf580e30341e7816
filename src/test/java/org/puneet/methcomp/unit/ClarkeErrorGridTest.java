package org.puneet.methcomp.unit;

import org.junit.jupiter.api.Test;
import org.puneet.methcomp.exceptions.ValidationException;
import org.puneet.methcomp.glucose.ClarkeErrorGrid;
import org.puneet.methcomp.glucose.ClarkeErrorGridResult;
import org.puneet.methcomp.glucose.ClarkeZone;
import org.puneet.methcomp.glucose.GlucoseUnit;
import org.puneet.methcomp.model.MeasurementSeries;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ClarkeErrorGridTest {

    private final ClarkeErrorGrid mgdl = new ClarkeErrorGrid(GlucoseUnit.MGDL);

    @Test
    void testCanonicalPointsPerZone() {
        assertEquals(ClarkeZone.A, mgdl.zone(100, 110));
        assertEquals(ClarkeZone.A, mgdl.zone(50, 60));
        assertEquals(ClarkeZone.B, mgdl.zone(100, 130));
        assertEquals(ClarkeZone.C, mgdl.zone(150, 10));
        assertEquals(ClarkeZone.C, mgdl.zone(100, 250));
        assertEquals(ClarkeZone.D, mgdl.zone(50, 100));
        assertEquals(ClarkeZone.D, mgdl.zone(300, 100));
        assertEquals(ClarkeZone.E, mgdl.zone(50, 200));
        assertEquals(ClarkeZone.E, mgdl.zone(200, 50));
    }

    @Test
    void testMmolBoundariesScaled() {
        ClarkeErrorGrid mmol = new ClarkeErrorGrid(GlucoseUnit.MMOL);
        assertEquals(ClarkeZone.A, mmol.zone(100 / 18.0, 110 / 18.0));
        assertEquals(ClarkeZone.D, mmol.zone(50 / 18.0, 100 / 18.0));
        assertEquals(ClarkeZone.E, mmol.zone(50 / 18.0, 200 / 18.0));
    }

    @Test
    void testClassifySeries() throws Exception {
        MeasurementSeries series = MeasurementSeries.of(
            new double[] {100, 100, 150, 50, 50}, new double[] {110, 130, 10, 100, 200});
        ClarkeErrorGridResult result = mgdl.classify(series);

        assertEquals(List.of(ClarkeZone.A, ClarkeZone.B, ClarkeZone.C, ClarkeZone.D, ClarkeZone.E),
            result.getZones());
        assertEquals(5, result.getSampleSize());
        for (ClarkeZone zone : ClarkeZone.values()) {
            assertEquals(1, result.getCount(zone));
            assertEquals(20.0, result.getPercentage(zone), 1e-12);
        }
        assertEquals(40.0, result.getClinicallyAcceptablePercentage(), 1e-12);
        assertEquals(GlucoseUnit.MGDL, result.getUnit());
    }

    @Test
    void testNonPositiveReferenceRejected() throws Exception {
        MeasurementSeries series = MeasurementSeries.of(new double[] {100, 0}, new double[] {100, 10});
        ValidationException ex = assertThrows(ValidationException.class, () -> mgdl.classify(series));
        assertEquals(ValidationException.ValidationType.INVALID_VALUE, ex.getValidationType());
        assertEquals(1, ex.getIndex());
    }

    @Test
    void testUnitParsing() {
        assertEquals(GlucoseUnit.MMOL, GlucoseUnit.fromString("mmol"));
        assertEquals(GlucoseUnit.MGDL, GlucoseUnit.fromString("mg/dl"));
        assertEquals(GlucoseUnit.MGDL, GlucoseUnit.fromString("MGDL"));
        assertEquals(18.0, GlucoseUnit.MMOL.getFactor());
        assertThrows(IllegalArgumentException.class, () -> GlucoseUnit.fromString("g/l"));
    }
}
