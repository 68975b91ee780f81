package com.tazifor.planner.dto;

import com.tazifor.planner.geo.model.LatLon;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PointDto {
    @NotNull
    private Double lat;
    @NotNull
    private Double lon;

    public LatLon toLatLon() {
        return LatLon.of(lat, lon);
    }
}
