package com.tazifor.planner.geo.util;

import com.tazifor.planner.exception.InvalidCoordinateException;
import com.tazifor.planner.exception.InvalidParameterException;
import com.tazifor.planner.geo.model.LatLon;
import com.tazifor.planner.geo.model.Polygon;

import java.util.List;

/**
 * Spherical-earth helpers shared by coverage and route sequencing.
 * <p>
 * Everything here is a pure static function; the earth is a sphere of mean
 * radius {@value #EARTH_RADIUS_METERS} m.
 * </p>
 */
public final class Geo {
    private Geo() {}

    public static final double EARTH_RADIUS_METERS = 6_371_000.0;
    public static final double EARTH_RADIUS_KM = 6_371.0;

    /** Tolerance for "point lies on an edge", in squared degrees (cross-product units). */
    private static final double EDGE_EPSILON = 1e-10;

    /**
     * Determines whether a point lies inside a polygon, <b>counting the boundary as inside</b>.
     * <p>
     * Two passes:
     * <ol>
     *   <li>Edge pass: if the point lies on any edge or vertex (within {@link #EDGE_EPSILON}),
     *       it is inside. A grid point that lands exactly on an area's border therefore gets
     *       a circle.</li>
     *   <li>Ray casting (even–odd rule): shoot a horizontal ray east from the point and
     *       count edge crossings; odd means inside.</li>
     * </ol>
     *
     * <pre>
     *               (3) •─────• (2)
     *                    │     │
     *     test point → ● │     │
     *                    │     │
     *               (4) •─────• (1)
     *
     *     ───────────────▶  ray crosses the left edge once → inside
     * </pre>
     *
     * Both passes visit every edge {@code j → i}, including the closing edge from the last
     * vertex back to the first.
     * Reliable for simple (non-self-intersecting) convex and concave polygons; coordinates
     * are treated as planar, which is fine for city-sized areas away from the antimeridian.
     *
     * @param p the test point
     * @param polygon the polygon to test against
     * @return {@code true} if {@code p} is inside or on the boundary of {@code polygon}
     */
    public static boolean pointInPolygon(LatLon p, Polygon polygon) {
        List<LatLon> ring = polygon.points();
        int n = ring.size();

        for (int i = 0, j = n - 1; i < n; j = i++) {
            if (onSegment(p, ring.get(i), ring.get(j))) {
                return true;
            }
        }

        int crossings = 0;
        for (int i = 0, j = n - 1; i < n; j = i++) {
            if (rayCrosses(p, ring.get(i), ring.get(j))) {
                crossings++;
            }
        }
        return crossings % 2 == 1;
    }

    /** Whether {@code p} lies on segment {@code a-b}: inside its bounding box and collinear. */
    static boolean onSegment(LatLon p, LatLon a, LatLon b) {
        boolean withinBox =
            p.lon() >= Math.min(a.lon(), b.lon()) - EDGE_EPSILON && p.lon() <= Math.max(a.lon(), b.lon()) + EDGE_EPSILON
                && p.lat() >= Math.min(a.lat(), b.lat()) - EDGE_EPSILON && p.lat() <= Math.max(a.lat(), b.lat()) + EDGE_EPSILON;
        if (!withinBox) {
            return false;
        }
        double cross = (p.lat() - a.lat()) * (b.lon() - a.lon()) - (p.lon() - a.lon()) * (b.lat() - a.lat());
        return Math.abs(cross) < EDGE_EPSILON;
    }

    /** Whether the eastward ray from {@code p} crosses edge {@code a-b}; half-open in latitude. */
    private static boolean rayCrosses(LatLon p, LatLon a, LatLon b) {
        if ((a.lat() > p.lat()) == (b.lat() > p.lat())) {
            return false;
        }
        double lonAtRay = (b.lon() - a.lon()) * (p.lat() - a.lat()) / (b.lat() - a.lat()) + a.lon();
        return p.lon() < lonAtRay;
    }

    /**
     * Haversine great-circle distance in kilometers.
     *
     * @throws InvalidCoordinateException if either point is non-finite or out of range
     */
    public static double distanceKm(LatLon a, LatLon b) {
        return centralAngle(requireValid(a), requireValid(b)) * EARTH_RADIUS_KM;
    }

    /** Same as {@link #distanceKm(LatLon, LatLon)}, in meters. */
    public static double distanceMeters(LatLon a, LatLon b) {
        return centralAngle(requireValid(a), requireValid(b)) * EARTH_RADIUS_METERS;
    }

    private static double centralAngle(LatLon a, LatLon b) {
        double dLat = Math.toRadians(b.lat() - a.lat());
        double dLon = Math.toRadians(b.lon() - a.lon());
        double la1 = Math.toRadians(a.lat()), la2 = Math.toRadians(b.lat());
        double h = Math.sin(dLat/2)*Math.sin(dLat/2) +
            Math.cos(la1)*Math.cos(la2) * Math.sin(dLon/2)*Math.sin(dLon/2);
        // clamp: rounding can push h a hair above 1 for antipodal points
        return 2 * Math.asin(Math.sqrt(Math.min(1.0, h)));
    }

    /**
     * Converts a north-south distance into degrees of latitude.
     * One degree of latitude is the same length everywhere on a sphere.
     */
    public static double metersToLatDegrees(double meters) {
        requireFinite(meters, "meters");
        return meters / EARTH_RADIUS_METERS * (180 / Math.PI);
    }

    /**
     * Converts an east-west distance into degrees of longitude at a given latitude.
     * <p>
     * Meridians converge toward the poles, so the same distance spans more degrees
     * of longitude the farther the reference latitude is from the equator:
     * </p>
     * <pre>
     *   lonDeg = meters / (R * cos(lat)) * 180/π
     * </pre>
     * Callers sweeping a box should pass the box's more poleward latitude; that gives the
     * smallest step, valid everywhere in the box.
     */
    public static double metersToLonDegrees(double meters, double referenceLatDegrees) {
        requireFinite(meters, "meters");
        if (!Double.isFinite(referenceLatDegrees) || Math.abs(referenceLatDegrees) > 90.0)
            throw new InvalidCoordinateException("reference latitude out of range: " + referenceLatDegrees);
        return meters / (EARTH_RADIUS_METERS * Math.cos(Math.toRadians(referenceLatDegrees))) * (180 / Math.PI);
    }

    /**
     * Returns {@code p} unchanged if it is finite and within [-90, 90] x [-180, 180].
     *
     * @throws InvalidCoordinateException otherwise
     */
    public static LatLon requireValid(LatLon p) {
        if (p == null)
            throw new InvalidCoordinateException("coordinate is missing");
        if (!p.allFinite() || !p.inRange())
            throw new InvalidCoordinateException("invalid coordinate: lat=" + p.lat() + ", lon=" + p.lon());
        return p;
    }

    private static void requireFinite(double value, String name) {
        if (!Double.isFinite(value))
            throw new InvalidParameterException(name + " must be finite, got " + value);
    }
}
