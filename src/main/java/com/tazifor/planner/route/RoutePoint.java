package com.tazifor.planner.route;

import com.tazifor.planner.geo.model.LatLon;

/**
 * A candidate destination.
 *
 * @param id        unique within one sequencing run; also the tie-breaker (ascending)
 * @param point     location of the destination
 * @param indicator desirability weight, {@code > 0}; higher pulls the stop earlier
 */
public record RoutePoint(String id, LatLon point, double indicator) {
    public static RoutePoint of(String id, double lat, double lon, double indicator) {
        return new RoutePoint(id, LatLon.of(lat, lon), indicator);
    }
}
