package com.tazifor.planner.route;

import com.tazifor.planner.exception.InvalidIndicatorException;
import com.tazifor.planner.exception.InvalidParameterException;
import com.tazifor.planner.exception.PlanningNotice;
import com.tazifor.planner.geo.model.LatLon;
import com.tazifor.planner.geo.util.Geo;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Greedy itinerary builder.
 *
 * <h3>Selection rule</h3>
 * Starting from a reference point (usually the traveller's position), each step picks the
 * remaining candidate with the smallest
 * <pre>
 *   adjustedDistance = distanceKm(reference, candidate) / candidate.indicator
 * </pre>
 * then moves the reference onto the picked candidate. A highly rated place far away can
 * therefore beat a mediocre one next door.
 *
 * <h3>Tie-break</h3>
 * Equal adjusted distances are resolved by ascending candidate id ({@link String#compareTo}),
 * so the same input always produces the same itinerary regardless of list order.
 *
 * <p>No backtracking and no optimality guarantee; this is not a TSP solver.
 * The caller's candidate list is copied on construction and never modified, so
 * {@link #run()} can be called any number of times.</p>
 */
public final class RouteSequencer {

    private final List<RoutePoint> candidates;
    private final LatLon start;
    private final int nPoints;

    /**
     * @throws InvalidIndicatorException if any indicator is not a positive finite number
     * @throws com.tazifor.planner.exception.InvalidCoordinateException if the start or a candidate
     *         location is invalid
     * @throws InvalidParameterException if {@code nPoints < 0}, ids are missing or repeated
     */
    public RouteSequencer(List<RoutePoint> candidates, LatLon start, int nPoints) {
        if (candidates == null)
            throw new InvalidParameterException("candidates must not be null");
        if (nPoints < 0)
            throw new InvalidParameterException("nPoints must be >= 0, got " + nPoints);
        this.start = Geo.requireValid(start);

        Set<String> seen = new HashSet<>();
        for (RoutePoint c : candidates) {
            if (c == null || c.id() == null)
                throw new InvalidParameterException("candidate id is missing");
            if (!seen.add(c.id()))
                throw new InvalidParameterException("duplicate candidate id: " + c.id());
            if (!Double.isFinite(c.indicator()) || c.indicator() <= 0)
                throw new InvalidIndicatorException("indicator of '" + c.id() + "' must be > 0, got " + c.indicator());
            Geo.requireValid(c.point());
        }
        this.candidates = List.copyOf(candidates);
        this.nPoints = nPoints;
    }

    public Itinerary run() {
        if (candidates.isEmpty()) {
            return Itinerary.empty(PlanningNotice.EMPTY_CANDIDATE_POOL);
        }

        List<RoutePoint> pool = new ArrayList<>(candidates);
        List<ItineraryStop> stops = new ArrayList<>(Math.min(nPoints, pool.size()));
        LatLon reference = start;

        while (stops.size() < nPoints && !pool.isEmpty()) {
            int best = -1;
            double bestAdjusted = Double.POSITIVE_INFINITY;
            double bestLeg = 0;

            for (int i = 0; i < pool.size(); i++) {
                RoutePoint c = pool.get(i);
                double leg = Geo.distanceKm(reference, c.point());
                double adjusted = leg / c.indicator();
                if (best < 0 || adjusted < bestAdjusted
                    || (adjusted == bestAdjusted && c.id().compareTo(pool.get(best).id()) < 0)) {
                    best = i;
                    bestAdjusted = adjusted;
                    bestLeg = leg;
                }
            }

            RoutePoint picked = pool.remove(best);
            stops.add(new ItineraryStop(stops.size() + 1, picked, bestAdjusted, bestLeg));
            reference = picked.point();
        }
        return new Itinerary(stops, List.of());
    }
}
