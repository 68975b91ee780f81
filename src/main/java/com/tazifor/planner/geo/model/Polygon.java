package com.tazifor.planner.geo.model;

import com.tazifor.planner.exception.InvalidGeometryException;

import java.util.List;

/**
 * Represents a search area as an <b>ordered list of latitude/longitude vertices</b>.
 * <p>
 * Each vertex {@code i} is connected to {@code i+1}, and the last vertex
 * automatically connects back to the first, so the first vertex must <b>not</b>
 * be repeated at the end.
 * </p>
 *
 * <h3>Example</h3>
 * <pre>{@code
 * Polygon historicCentre = new Polygon(List.of(
 *     LatLon.of(41.9066, 12.4441),
 *     LatLon.of(41.9209, 12.4858),
 *     LatLon.of(41.8856, 12.5078),
 *     LatLon.of(41.8744, 12.4799)
 * ));
 * }</pre>
 *
 * Validation happens here, once, so every later containment test can assume
 * a well-formed ring:
 * <ul>
 *   <li>at least three vertices</li>
 *   <li>every coordinate finite and inside the valid latitude/longitude range</li>
 * </ul>
 * The vertex list is copied, so the polygon stays immutable even if the caller
 * keeps mutating the list it passed in.
 *
 * @throws InvalidGeometryException if either rule above is violated
 */
public record Polygon(List<LatLon> points) {

    public Polygon {
        if (points == null || points.size() < 3)
            throw new InvalidGeometryException("polygon needs at least 3 vertices, got "
                + (points == null ? 0 : points.size()));
        for (int i = 0; i < points.size(); i++) {
            LatLon p = points.get(i);
            if (p == null || !p.allFinite() || !p.inRange())
                throw new InvalidGeometryException("polygon vertex " + i + " is not a valid coordinate: " + p);
        }
        points = List.copyOf(points);
    }

    public static Polygon of(LatLon... vertices) {
        return new Polygon(List.of(vertices));
    }
}
