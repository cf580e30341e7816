package org.puneet.methcomp.glucose;

import java.util.List;

/**
 * Clarke zone of each (reference, test) pair with per-zone totals.
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-04
 */
public final class ClarkeErrorGridResult extends ErrorGridResult<ClarkeZone> {

    public ClarkeErrorGridResult(List<ClarkeZone> zones, GlucoseUnit unit) {
        super(ClarkeZone.class, zones, unit);
    }
}
