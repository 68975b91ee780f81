package com.tazifor.planner.geo.model;

/**
 * The lattice a coverage sweep walks: {@code rows x cols} points starting at
 * ({@code minLat}, {@code minLon}), spaced exactly {@code latStep} / {@code lonStep} degrees apart.
 * Every lattice point lies inside the box ({@code maxLat}, {@code maxLon}), up to rounding.
 */
public record GridSpec(double minLat, double minLon, double maxLat, double maxLon,
                       double latStep, double lonStep, long rows, long cols) {

    /** Latitude of row {@code i}; computed from the index, never accumulated. */
    public double latAt(long i) {
        return minLat + i * latStep;
    }

    /** Longitude of column {@code j}; computed from the index, never accumulated. */
    public double lonAt(long j) {
        return minLon + j * lonStep;
    }
}
