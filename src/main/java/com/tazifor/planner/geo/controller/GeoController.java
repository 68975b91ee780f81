package com.tazifor.planner.geo.controller;

import com.tazifor.planner.geo.model.LatLon;
import com.tazifor.planner.geo.util.Geo;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/geo")
public class GeoController {

    // Haversine distance between two coordinates
    @GetMapping("/distance")
    public Map<String, Object> distance(@RequestParam double fromLat, @RequestParam double fromLon,
                                        @RequestParam double toLat, @RequestParam double toLon) {
        double km = Geo.distanceKm(LatLon.of(fromLat, fromLon), LatLon.of(toLat, toLon));
        return Map.of("from", LatLon.of(fromLat, fromLon), "to", LatLon.of(toLat, toLon), "km", km);
    }
}
