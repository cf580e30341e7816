package org.puneet.methcomp.glucose;

import java.util.List;
import java.util.Objects;

/**
 * Parkes zone of each (reference, test) pair with per-zone totals.
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-05
 */
public final class ParkesErrorGridResult extends ErrorGridResult<ParkesZone> {

    private final DiabetesType diabetesType;

    public ParkesErrorGridResult(List<ParkesZone> zones, GlucoseUnit unit, DiabetesType diabetesType) {
        super(ParkesZone.class, zones, unit);
        this.diabetesType = Objects.requireNonNull(diabetesType, "Diabetes type cannot be null");
    }

    public DiabetesType getDiabetesType() {
        return diabetesType;
    }

    @Override
    public String toString() {
        return super.toString() + " {" + diabetesType.getLabel() + "}";
    }
}
