package org.puneet.methcomp.glucose;

import org.puneet.methcomp.exceptions.ValidationException;
import org.puneet.methcomp.model.MeasurementSeries;
import org.puneet.methcomp.util.InputValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.geom.Path2D;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Parkes (consensus) error grid classification of glucose readings against a
 * reference method, for type 1 or type 2 diabetes. Series x values are the
 * reference, y values the test method.
 *
 * <p>Zones B to E are polygons in mg/dL. The outer boundaries of each zone
 * are rays of fixed slope, cut off at
 * {@code maxX = max(max(reference) + 20, 550)} and
 * {@code maxY = max(max(test) + 20, maxX)}, so every pair lies inside the
 * drawn grid. A pair takes the most severe zone whose polygon contains it,
 * and zone A otherwise. Readings in mmol/L are converted to mg/dL first.</p>
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-05
 */
public class ParkesErrorGrid {
    private static final Logger logger = LoggerFactory.getLogger(ParkesErrorGrid.class);

    static final String ANALYSIS = "Parkes error grid";

    /** Smallest extent of the grid on both axes, in mg/dL. */
    private static final double GRID_EXTENT = 550.0;

    /** Margin added beyond the largest reading, in mg/dL. */
    private static final double GRID_MARGIN = 20.0;

    private static final ParkesZone[] BY_SEVERITY = {ParkesZone.E, ParkesZone.D, ParkesZone.C, ParkesZone.B};

    private final DiabetesType type;
    private final GlucoseUnit unit;

    public ParkesErrorGrid(DiabetesType type, GlucoseUnit unit) {
        this.type = Objects.requireNonNull(type, "Diabetes type cannot be null");
        this.unit = Objects.requireNonNull(unit, "Unit cannot be null");
    }

    public DiabetesType getType() {
        return type;
    }

    public GlucoseUnit getUnit() {
        return unit;
    }

    /**
     * Classifies every pair.
     *
     * @param series reference values as x, test values as y
     * @return zones and totals
     * @throws ValidationException if a reading is negative
     */
    public ParkesErrorGridResult classify(MeasurementSeries series) throws ValidationException {
        Objects.requireNonNull(series, "Series cannot be null");
        InputValidator.validateCount(series.size(), 1, ANALYSIS);
        logger.info("Classifying {} pairs on the {} ({}, {})", series.size(), ANALYSIS,
            type.getLabel(), unit.getLabel());

        double maxReference = Double.NEGATIVE_INFINITY;
        double maxTest = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < series.size(); i++) {
            if (series.x(i) < 0.0) {
                throw ValidationException.invalidValue("reference", i, series.x(i));
            }
            if (series.y(i) < 0.0) {
                throw ValidationException.invalidValue("test", i, series.y(i));
            }
            maxReference = Math.max(maxReference, series.x(i));
            maxTest = Math.max(maxTest, series.y(i));
        }

        Map<ParkesZone, List<Path2D>> regions = regions(maxReference * unit.getFactor(), maxTest * unit.getFactor());
        List<ParkesZone> zones = new ArrayList<>(series.size());
        for (int i = 0; i < series.size(); i++) {
            zones.add(locate(regions, series.x(i) * unit.getFactor(), series.y(i) * unit.getFactor()));
        }

        ParkesErrorGridResult result = new ParkesErrorGridResult(zones, unit, type);
        logger.info("{} completed: {}", ANALYSIS, result);
        return result;
    }

    /**
     * Zone of a single reading.
     *
     * @param reference reference value, not negative
     * @param test test method value, not negative
     * @return the zone
     */
    public ParkesZone zone(double reference, double test) {
        double x = reference * unit.getFactor();
        double y = test * unit.getFactor();
        return locate(regions(x, y), x, y);
    }

    private static ParkesZone locate(Map<ParkesZone, List<Path2D>> regions, double x, double y) {
        for (ParkesZone zone : BY_SEVERITY) {
            for (Path2D polygon : regions.get(zone)) {
                if (polygon.contains(x, y)) {
                    return zone;
                }
            }
        }
        return ParkesZone.A;
    }

    /**
     * Zone polygons in mg/dL, each zone as a lower and an upper region
     * (zone E has only the upper one).
     */
    private Map<ParkesZone, List<Path2D>> regions(double maxReference, double maxTest) {
        double maxX = Math.max(maxReference + GRID_MARGIN, GRID_EXTENT);
        double maxY = Math.max(Math.max(maxTest + GRID_MARGIN, maxX), GRID_EXTENT);

        Map<ParkesZone, List<Path2D>> regions = new EnumMap<>(ParkesZone.class);
        if (type == DiabetesType.TYPE_1) {
            regions.put(ParkesZone.B, List.of(
                lower(maxX, 385, 300, slope(385, 300, 550, 450), 50, 0, 50, 30, 170, 145),
                upper(maxY, 280, 380, slope(280, 380, 430, 550), 0, 50, 30, 50, 140, 170)));
            regions.put(ParkesZone.C, List.of(
                lower(maxX, 260, 130, slope(260, 130, 550, 250), 120, 0, 120, 30),
                upper(maxY, 70, 110, slope(70, 110, 260, 550), 0, 60, 30, 60, 50, 80)));
            regions.put(ParkesZone.D, List.of(
                lower(maxX, 250, 40, slope(250, 40, 550, 150), 250, 0),
                upper(maxY, 80, 215, slope(80, 215, 125, 550), 0, 100, 25, 100, 50, 125)));
            regions.put(ParkesZone.E, List.of(
                upper(maxY, 35, 155, slope(35, 155, 50, 550), 0, 150)));
        } else {
            regions.put(ParkesZone.B, List.of(
                lower(maxX, 330, 230, slope(330, 230, 550, 450), 50, 0, 50, 30, 90, 80),
                upper(maxY, 230, 330, slope(230, 330, 440, 550), 0, 50, 30, 50)));
            regions.put(ParkesZone.C, List.of(
                lower(maxX, 260, 130, slope(260, 130, 550, 250), 90, 0),
                upper(maxY, 30, 60, slope(30, 60, 280, 550), 0, 60)));
            regions.put(ParkesZone.D, List.of(
                lower(maxX, 410, 110, slope(410, 110, 550, 160), 250, 0, 250, 40),
                upper(maxY, 35, 90, slope(35, 90, 125, 550), 0, 80, 25, 80)));
            regions.put(ParkesZone.E, List.of(
                upper(maxY, 35, 200, slope(35, 200, 50, 550), 0, 200)));
        }
        return regions;
    }

    private static double slope(double x, double y, double xEnd, double yEnd) {
        return (yEnd - y) / (xEnd - x);
    }

    /**
     * Region below a boundary: the given vertices, then the anchor, then the
     * ray from the anchor cut at {@code maxX}, closed along the x axis.
     */
    private static Path2D lower(double maxX, double anchorX, double anchorY, double slope, double... vertices) {
        Path2D path = polyline(vertices);
        path.lineTo(anchorX, anchorY);
        path.lineTo(maxX, anchorY + (maxX - anchorX) * slope);
        path.lineTo(maxX, 0);
        path.closePath();
        return path;
    }

    /**
     * Region above a boundary: the given vertices, then the anchor, then the
     * ray from the anchor cut at {@code maxY}, closed along the y axis.
     */
    private static Path2D upper(double maxY, double anchorX, double anchorY, double slope, double... vertices) {
        Path2D path = polyline(vertices);
        path.lineTo(anchorX, anchorY);
        path.lineTo(anchorX + (maxY - anchorY) / slope, maxY);
        path.lineTo(0, maxY);
        path.closePath();
        return path;
    }

    private static Path2D polyline(double... vertices) {
        Path2D path = new Path2D.Double();
        path.moveTo(vertices[0], vertices[1]);
        for (int k = 2; k + 1 < vertices.length; k += 2) {
            path.lineTo(vertices[k], vertices[k + 1]);
        }
        return path;
    }
}
