package com.tazifor.planner.geo.coverage;

import com.tazifor.planner.exception.InvalidParameterException;
import com.tazifor.planner.geo.model.BBox;
import com.tazifor.planner.geo.model.CircleCenter;
import com.tazifor.planner.geo.model.CoverageRequest;
import com.tazifor.planner.geo.model.GridSpec;
import com.tazifor.planner.geo.model.LatLon;
import com.tazifor.planner.geo.model.Polygon;
import com.tazifor.planner.geo.util.Geo;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@code CoverageGenerator} tiles one or more polygons with search circles of a fixed radius,
 * so that a "nearby search" API limited to circular queries can be paged over an arbitrary area.
 *
 * <h3>How the grid is laid out</h3>
 * <pre>
 *   maxLat ─ ─ ─ ─ ─ ─ ─ ─ ─ ┐
 *            •   •   •   •  │   rows and columns start on minLat / minLon and stop at
 *            │   │   │   │  │   the last whole step inside the box; the far edge is only
 *            •   •   •   •  │   sampled when the span is a whole number of steps
 *            │   │   │   │  │
 *   minLat ─ •───•───•───•──┘
 *            minLon       maxLon
 * </pre>
 * <ul>
 *   <li>The box is the union bounding box of all polygon vertices.</li>
 *   <li>{@code latStep = metersToLatDegrees(radius) * (1 + spacingFactor)}</li>
 *   <li>{@code lonStep = metersToLonDegrees(radius, polewardLat) * (1 + spacingFactor)}: the
 *       poleward bound gives the narrowest step, so the box is never under-sampled.</li>
 *   <li>{@code spacingFactor = 0} puts centers one radius apart (heavy overlap);
 *       {@code 1} puts them two radii apart (tangent circles).</li>
 * </ul>
 *
 * <h3>Sweep</h3>
 * Rows and columns are addressed by index ({@code min + i * step}), never by repeatedly adding
 * the step, so rounding drift cannot drop or duplicate the edge row. Neighbouring rows are
 * exactly one {@code latStep} apart and neighbouring columns one {@code lonStep}. Each grid
 * point is tested against the polygons in input order with the boundary-inclusive
 * {@link Geo#pointInPolygon(LatLon, Polygon)}; the first match claims it, points outside every
 * polygon are dropped. Overlapping polygons therefore never produce duplicate centers.
 *
 * <p>Cost is {@code rows x cols x polygons x vertices}. Fine for offline batch runs over
 * city-sized areas, not for large regions on a request thread.</p>
 */
@Slf4j
public final class CoverageGenerator {

    /** Keeps the far edge row when {@code (max - min) / step} is a whole number up to rounding. */
    private static final double LINE_COUNT_TOLERANCE = 1e-9;

    private final CoverageRequest request;

    public CoverageGenerator(CoverageRequest request) {
        if (request == null)
            throw new InvalidParameterException("coverage request must not be null");
        this.request = request;
    }

    /**
     * Runs the sweep. Never returns {@code null}; an empty polygon list yields an empty
     * result flagged {@link com.tazifor.planner.exception.PlanningNotice#NO_AREAS_PROVIDED}.
     */
    public CoverageResult generate() {
        Optional<GridSpec> maybeGrid = grid();
        if (maybeGrid.isEmpty()) {
            return CoverageResult.noAreas();
        }
        GridSpec grid = maybeGrid.get();
        List<Polygon> polygons = request.polygons();
        log.debug("Sweeping {} rows x {} cols over {} polygon(s)", grid.rows(), grid.cols(), polygons.size());

        List<CircleCenter> out = new ArrayList<>();
        for (long r = 0; r < grid.rows(); r++) {
            double lat = grid.latAt(r);
            for (long c = 0; c < grid.cols(); c++) {
                LatLon p = new LatLon(lat, grid.lonAt(c));
                int areaId = owningArea(p, polygons);
                if (areaId > 0) {
                    out.add(new CircleCenter(p, request.radiusMeters(), areaId));
                }
            }
        }
        return new CoverageResult(out, grid, List.of());
    }

    /**
     * The lattice {@link #generate()} would sweep, or empty if there are no polygons.
     */
    public Optional<GridSpec> grid() {
        if (request.polygons().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(gridFor(BBox.enclosing(request.polygons()),
            request.radiusMeters(), request.spacingFactor()));
    }

    /**
     * Builds the sweep lattice for a bounding box.
     */
    public static GridSpec gridFor(BBox bb, double radiusMeters, double spacingFactor) {
        double latStep = latStep(radiusMeters, spacingFactor);
        double lonStep = lonStep(radiusMeters, spacingFactor, bb.polewardLat());
        long rows = lineCount(bb.maxLat() - bb.minLat(), latStep);
        long cols = lineCount(bb.maxLon() - bb.minLon(), lonStep);
        return new GridSpec(bb.minLat(), bb.minLon(), bb.maxLat(), bb.maxLon(), latStep, lonStep, rows, cols);
    }

    public static double latStep(double radiusMeters, double spacingFactor) {
        return Geo.metersToLatDegrees(radiusMeters) * (1 + spacingFactor);
    }

    public static double lonStep(double radiusMeters, double spacingFactor, double referenceLat) {
        return Geo.metersToLonDegrees(radiusMeters, referenceLat) * (1 + spacingFactor);
    }

    /** Number of lattice lines {@code min + i * step} that fit in {@code [min, min + span]}. */
    private static long lineCount(double span, double step) {
        if (span <= 0) return 1;
        return (long) Math.floor(span / step + LINE_COUNT_TOLERANCE) + 1;
    }

    /** 1-based index of the first polygon containing {@code p}, or 0. */
    private static int owningArea(LatLon p, List<Polygon> polygons) {
        for (int i = 0; i < polygons.size(); i++) {
            if (Geo.pointInPolygon(p, polygons.get(i))) {
                return i + 1;
            }
        }
        return 0;
    }
}
