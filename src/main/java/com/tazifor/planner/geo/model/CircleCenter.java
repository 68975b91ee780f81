package com.tazifor.planner.geo.model;

/**
 * One search circle produced by a coverage sweep.
 *
 * @param point        circle center
 * @param radiusMeters search radius around {@code point}
 * @param areaId       1-based index of the first input polygon containing {@code point}
 */
public record CircleCenter(LatLon point, double radiusMeters, int areaId) {
    public double lat() { return point.lat(); }

    public double lon() { return point.lon(); }
}
