package com.tazifor.planner.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Coverage request body. Omitted radius / spacing fall back to
 * {@code planner.coverage.default-*}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CoverageRequestDto {

    /** Each inner list is one polygon's vertices, implicitly closed. */
    @NotNull
    private List<List<@NotNull @Valid PointDto>> polygons;

    private Double radiusMeters;

    private Double spacingFactor;
}
