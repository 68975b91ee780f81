package com.tazifor.planner.geo.controller;

import com.tazifor.planner.dto.CoverageRequestDto;
import com.tazifor.planner.dto.CoverageResponse;
import com.tazifor.planner.geo.service.CoverageService;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/coverage")
public class CoverageController {
    private final CoverageService svc;

    public CoverageController(CoverageService svc) { this.svc = svc; }

    // 1) Circle centers covering the given areas
    @PostMapping
    public CoverageResponse cover(@Valid @RequestBody CoverageRequestDto body) {
        return CoverageResponse.from(svc.cover(body));
    }

    // 2) Same sweep as a circles file for the nearby-search batch job
    @PostMapping(value = "/csv", produces = "text/csv")
    public String coverCsv(@Valid @RequestBody CoverageRequestDto body) {
        return svc.toCsv(svc.cover(body));
    }

    // 3) Degree steps a sweep would use at a latitude
    @GetMapping(value = "/step", produces = MediaType.APPLICATION_JSON_VALUE)
    public CoverageService.StepPreview step(@RequestParam double radiusMeters,
                                            @RequestParam(defaultValue = "0") double spacingFactor,
                                            @RequestParam(defaultValue = "0") double referenceLat) {
        return svc.stepPreview(radiusMeters, spacingFactor, referenceLat);
    }
}
