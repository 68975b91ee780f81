package com.tazifor.planner.dto;

import com.tazifor.planner.exception.PlanningNotice;
import com.tazifor.planner.geo.coverage.CoverageResult;
import com.tazifor.planner.geo.model.GridSpec;

import java.util.List;

public record CoverageResponse(List<Center> centers, int count, List<PlanningNotice> notices, GridSpec grid) {

    public record Center(double lat, double lon, double radiusMeters, int areaId) {}

    public static CoverageResponse from(CoverageResult result) {
        List<Center> centers = result.centers().stream()
            .map(c -> new Center(c.lat(), c.lon(), c.radiusMeters(), c.areaId()))
            .toList();
        return new CoverageResponse(centers, centers.size(), result.notices(), result.grid());
    }
}
