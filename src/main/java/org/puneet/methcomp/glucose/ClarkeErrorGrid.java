package org.puneet.methcomp.glucose;

import org.puneet.methcomp.exceptions.ValidationException;
import org.puneet.methcomp.model.MeasurementSeries;
import org.puneet.methcomp.util.InputValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Clarke error grid classification of glucose readings against a reference
 * method. Series x values are the reference, y values the test method.
 *
 * <p>Every pair starts in zone B and the zone rules are applied in the order
 * E, D, C, A, a later match overriding an earlier one. Boundaries are in mg/dL
 * and are scaled to the requested unit.</p>
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-04
 */
public class ClarkeErrorGrid {
    private static final Logger logger = LoggerFactory.getLogger(ClarkeErrorGrid.class);

    static final String ANALYSIS = "Clarke error grid";

    private final GlucoseUnit unit;

    public ClarkeErrorGrid(GlucoseUnit unit) {
        this.unit = Objects.requireNonNull(unit, "Unit cannot be null");
    }

    public GlucoseUnit getUnit() {
        return unit;
    }

    /**
     * Classifies every pair.
     *
     * @param series reference values as x, test values as y
     * @return zones and totals
     * @throws ValidationException if a reference value is not positive
     */
    public ClarkeErrorGridResult classify(MeasurementSeries series) throws ValidationException {
        Objects.requireNonNull(series, "Series cannot be null");
        InputValidator.validateCount(series.size(), 1, ANALYSIS);
        logger.info("Classifying {} pairs on the {} ({})", series.size(), ANALYSIS, unit.getLabel());

        List<ClarkeZone> zones = new ArrayList<>(series.size());
        for (int i = 0; i < series.size(); i++) {
            double reference = series.x(i);
            if (reference <= 0.0) {
                throw ValidationException.invalidValue("reference", i, reference);
            }
            zones.add(zone(reference, series.y(i)));
        }

        ClarkeErrorGridResult result = new ClarkeErrorGridResult(zones, unit);
        logger.info("{} completed: {}", ANALYSIS, result);
        return result;
    }

    /**
     * Zone of a single reading.
     *
     * @param reference reference value, positive
     * @param test test method value
     * @return the zone
     */
    public ClarkeZone zone(double reference, double test) {
        double f = unit.getFactor();
        ClarkeZone zone = ClarkeZone.B;

        if ((reference <= 70 / f && test >= 180 / f) || (reference >= 180 / f && test <= 70 / f)) {
            zone = ClarkeZone.E;
        }

        boolean testInD = test >= 70 / f && test < 180 / f;
        if ((reference < 70 / f || reference > 240 / f) && testInD) {
            zone = ClarkeZone.D;
        }

        double lowerC = 1.4 * (reference - 130 / f);
        double upperC = reference + 110 / f;
        if ((reference >= 130 / f && reference <= 180 / f && test < lowerC)
                || (reference > 70 / f && test > 180 / f && test > upperC)) {
            zone = ClarkeZone.C;
        }

        double relativeError = Math.abs(test - reference) / reference * 100.0;
        if (relativeError <= 20.0 || (reference < 70 / f && test < 70 / f)) {
            zone = ClarkeZone.A;
        }
        return zone;
    }
}
