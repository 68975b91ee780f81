package com.tazifor.planner.route;

import com.tazifor.planner.config.PlannerProperties;
import com.tazifor.planner.dto.CandidateDto;
import com.tazifor.planner.dto.RouteRequestDto;
import com.tazifor.planner.exception.InvalidParameterException;
import com.tazifor.planner.exception.PlanningNotice;
import com.tazifor.planner.geo.model.LatLon;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
public class RoutePlanningService {

    private final PlannerProperties properties;

    public RoutePlanningService(PlannerProperties properties) {
        this.properties = properties;
    }

    public Itinerary plan(RouteRequestDto dto) {
        List<RoutePoint> candidates = dto.getCandidates().stream()
            .map(CandidateDto::toRoutePoint)
            .toList();
        return plan(dto.getReference().toLatLon(), candidates, dto.getNPoints());
    }

    /**
     * @param nPoints stops wanted; {@code null} for {@code planner.route.default-stops}
     */
    public Itinerary plan(LatLon reference, List<RoutePoint> candidates, Integer nPoints) {
        PlannerProperties.Route cfg = properties.getRoute();
        if (candidates.size() > cfg.getMaxCandidates())
            throw new InvalidParameterException("too many candidates: " + candidates.size()
                + " (limit " + cfg.getMaxCandidates() + ")");

        int stops = nPoints != null ? nPoints : cfg.getDefaultStops();
        Itinerary itinerary = new RouteSequencer(candidates, reference, stops).run();

        if (itinerary.hasNotice(PlanningNotice.EMPTY_CANDIDATE_POOL)) {
            log.warn("Route requested with an empty candidate pool; returning an empty itinerary");
        } else {
            log.info("Sequenced {} stop(s) from {} candidate(s) (requested {}), {} km total",
                itinerary.size(), candidates.size(), stops, String.format("%.2f", itinerary.totalKm()));
        }
        return itinerary;
    }
}
