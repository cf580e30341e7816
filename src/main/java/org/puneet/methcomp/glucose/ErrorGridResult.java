package org.puneet.methcomp.glucose;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Zone assignment of each (reference, test) pair with per-zone totals,
 * shared by the Clarke and Parkes grids.
 *
 * @param <Z> the zone enum of the grid
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-04
 */
public abstract class ErrorGridResult<Z extends Enum<Z>> {

    private final Class<Z> zoneType;
    private final List<Z> zones;
    private final GlucoseUnit unit;
    private final Map<Z, Integer> counts;

    protected ErrorGridResult(Class<Z> zoneType, List<Z> zones, GlucoseUnit unit) {
        this.zoneType = Objects.requireNonNull(zoneType, "Zone type cannot be null");
        this.zones = List.copyOf(Objects.requireNonNull(zones, "Zones cannot be null"));
        this.unit = Objects.requireNonNull(unit, "Unit cannot be null");

        Map<Z, Integer> tally = new EnumMap<>(zoneType);
        for (Z zone : zoneType.getEnumConstants()) {
            tally.put(zone, 0);
        }
        for (Z zone : this.zones) {
            tally.merge(zone, 1, Integer::sum);
        }
        this.counts = Collections.unmodifiableMap(tally);
    }

    /** @return zone of each pair, in input order */
    public List<Z> getZones() { return zones; }

    public Z getZone(int index) { return zones.get(index); }

    public GlucoseUnit getUnit() { return unit; }

    public int getSampleSize() { return zones.size(); }

    /** @return count per zone, every zone present */
    public Map<Z, Integer> getCounts() { return counts; }

    public int getCount(Z zone) {
        return counts.get(zone);
    }

    /**
     * @param zone the zone
     * @return share of pairs in the zone, in percent
     */
    public double getPercentage(Z zone) {
        return zones.isEmpty() ? 0.0 : 100.0 * counts.get(zone) / zones.size();
    }

    /** @return share of pairs in the two least severe zones, in percent */
    public double getClinicallyAcceptablePercentage() {
        Z[] all = zoneType.getEnumConstants();
        return getPercentage(all[0]) + getPercentage(all[1]);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(getClass().getSimpleName()).append("[n=").append(zones.size());
        for (Z zone : zoneType.getEnumConstants()) {
            sb.append(String.format(", %s=%d (%.1f%%)", zone, counts.get(zone), getPercentage(zone)));
        }
        return sb.append(']').toString();
    }
}
