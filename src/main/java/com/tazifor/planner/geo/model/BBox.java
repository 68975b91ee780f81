package com.tazifor.planner.geo.model;

import java.util.List;

public record BBox(double minLat, double minLon, double maxLat, double maxLon) {
    /**
     * The latitude bound farther from the equator. Meridians converge fastest there,
     * so it yields the smallest longitude step of the box.
     */
    public double polewardLat() {
        return Math.abs(minLat) >= Math.abs(maxLat) ? minLat : maxLat;
    }

    /**
     * Computes the box enclosing every vertex of every polygon.
     *
     * @throws IllegalArgumentException if {@code polygons} is empty
     */
    public static BBox enclosing(List<Polygon> polygons) {
        if (polygons.isEmpty())
            throw new IllegalArgumentException("no polygons to enclose");

        double minLat = Double.MAX_VALUE, minLon = Double.MAX_VALUE;
        double maxLat = -Double.MAX_VALUE, maxLon = -Double.MAX_VALUE;

        for (Polygon poly : polygons) {
            for (LatLon pt : poly.points()) {
                minLat = Math.min(minLat, pt.lat());
                minLon = Math.min(minLon, pt.lon());
                maxLat = Math.max(maxLat, pt.lat());
                maxLon = Math.max(maxLon, pt.lon());
            }
        }
        return new BBox(minLat, minLon, maxLat, maxLon);
    }
}
