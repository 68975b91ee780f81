package com.tazifor.planner.geo.model;

/**
 * A geographic point in degrees. Range checks live in
 * {@link com.tazifor.planner.geo.util.Geo#requireValid(LatLon)} so that polygon vertices
 * and route candidates can report their own error category.
 */
public record LatLon(double lat, double lon) {
    public static LatLon of(double lat, double lon) { return new LatLon(lat, lon); }

    public boolean allFinite() {
        return Double.isFinite(lat) && Double.isFinite(lon);
    }

    public boolean inRange() {
        return lat >= -90.0 && lat <= 90.0 && lon >= -180.0 && lon <= 180.0;
    }
}
