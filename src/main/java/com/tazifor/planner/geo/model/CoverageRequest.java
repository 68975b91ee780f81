package com.tazifor.planner.geo.model;

import com.tazifor.planner.exception.InvalidParameterException;

import java.util.List;

/**
 * Everything one coverage computation needs. Validated on construction; polygons
 * validate themselves.
 *
 * @param polygons      areas to cover, in priority order (earlier wins on overlap)
 * @param radiusMeters  radius of each search circle, {@code > 0}
 * @param spacingFactor 0 = centers one radius apart, 1 = two radii apart (tangent circles)
 */
public record CoverageRequest(List<Polygon> polygons, double radiusMeters, double spacingFactor) {

    public CoverageRequest {
        if (polygons == null)
            throw new InvalidParameterException("polygons must not be null");
        if (!Double.isFinite(radiusMeters) || radiusMeters <= 0)
            throw new InvalidParameterException("radiusMeters must be > 0, got " + radiusMeters);
        if (!(spacingFactor >= 0.0 && spacingFactor <= 1.0))
            throw new InvalidParameterException("spacingFactor must be within [0, 1], got " + spacingFactor);
        polygons = List.copyOf(polygons);
    }
}
