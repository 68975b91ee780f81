package com.tazifor.planner.dto;

import com.tazifor.planner.exception.PlanningNotice;
import com.tazifor.planner.route.Itinerary;

import java.util.List;

public record ItineraryResponse(List<Stop> stops, int count, List<PlanningNotice> notices, double totalKm) {

    public record Stop(int order, String id, double lat, double lon, double indicator,
                       double adjustedDistance, double legKm) {}

    public static ItineraryResponse from(Itinerary itinerary) {
        List<Stop> stops = itinerary.stops().stream()
            .map(s -> new Stop(s.order(), s.id(), s.point().point().lat(), s.point().point().lon(),
                s.point().indicator(), s.adjustedDistance(), s.legKm()))
            .toList();
        return new ItineraryResponse(stops, stops.size(), itinerary.notices(), itinerary.totalKm());
    }
}
