package com.tazifor.planner.dto;

import com.tazifor.planner.route.RoutePoint;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A scored destination as delivered by the upstream ranking pipeline.
 * The indicator is taken as-is; how it was blended is not our concern.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CandidateDto {
    @NotBlank
    private String id;
    @NotNull
    private Double lat;
    @NotNull
    private Double lon;
    @NotNull
    private Double indicator;

    public RoutePoint toRoutePoint() {
        return RoutePoint.of(id, lat, lon, indicator);
    }
}
