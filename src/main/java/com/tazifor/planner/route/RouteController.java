package com.tazifor.planner.route;

import com.tazifor.planner.dto.ItineraryResponse;
import com.tazifor.planner.dto.RouteRequestDto;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/route")
public class RouteController {
    private final RoutePlanningService svc;

    public RouteController(RoutePlanningService svc) { this.svc = svc; }

    // Greedy visiting order for scored destinations
    @PostMapping
    public ItineraryResponse plan(@Valid @RequestBody RouteRequestDto body) {
        return ItineraryResponse.from(svc.plan(body));
    }
}
