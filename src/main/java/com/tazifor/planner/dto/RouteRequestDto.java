package com.tazifor.planner.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RouteRequestDto {

    /** Where the traveller starts. */
    @NotNull
    @Valid
    private PointDto reference;

    /** Stops wanted; {@code planner.route.default-stops} when absent. */
    @JsonProperty("nPoints")
    private Integer nPoints;

    @NotNull
    private List<@NotNull @Valid CandidateDto> candidates;
}
