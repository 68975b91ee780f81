package com.tazifor.planner.route;

import com.tazifor.planner.exception.PlanningNotice;

import java.util.List;

/**
 * Ordered, immutable visiting sequence produced by {@link RouteSequencer}.
 */
public record Itinerary(List<ItineraryStop> stops, List<PlanningNotice> notices) {

    public Itinerary {
        stops = List.copyOf(stops);
        notices = List.copyOf(notices);
    }

    public static Itinerary empty(PlanningNotice... notices) {
        return new Itinerary(List.of(), List.of(notices));
    }

    public int size() {
        return stops.size();
    }

    public boolean isEmpty() {
        return stops.isEmpty();
    }

    public List<String> ids() {
        return stops.stream().map(ItineraryStop::id).toList();
    }

    /** Sum of all legs, starting from the initial reference point. */
    public double totalKm() {
        return stops.stream().mapToDouble(ItineraryStop::legKm).sum();
    }

    public boolean hasNotice(PlanningNotice notice) {
        return notices.contains(notice);
    }
}
