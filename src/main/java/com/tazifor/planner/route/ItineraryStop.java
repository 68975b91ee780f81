package com.tazifor.planner.route;

/**
 * A selected destination annotated with how it was chosen.
 *
 * @param order            1-based visit order
 * @param point            the destination
 * @param adjustedDistance selection key at the time of the pick: leg length in km / indicator
 * @param legKm            great-circle distance from the previous reference point
 */
public record ItineraryStop(int order, RoutePoint point, double adjustedDistance, double legKm) {
    public String id() { return point.id(); }
}
