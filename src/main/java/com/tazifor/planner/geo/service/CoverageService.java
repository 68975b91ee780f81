package com.tazifor.planner.geo.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.tazifor.planner.config.PlannerProperties;
import com.tazifor.planner.dto.CoverageRequestDto;
import com.tazifor.planner.dto.PointDto;
import com.tazifor.planner.exception.InvalidParameterException;
import com.tazifor.planner.exception.PlanningNotice;
import com.tazifor.planner.geo.coverage.CoverageGenerator;
import com.tazifor.planner.geo.coverage.CoverageResult;
import com.tazifor.planner.geo.model.CoverageRequest;
import com.tazifor.planner.geo.model.GridSpec;
import com.tazifor.planner.geo.model.Polygon;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Runs coverage sweeps for the HTTP layer: fills in configured defaults, refuses sweeps
 * larger than {@code planner.coverage.max-grid-cells} and renders the CSV handed to the
 * nearby-search batch job.
 */
@Slf4j
@Service
public class CoverageService {

    private static final CsvMapper CSV = new CsvMapper();
    private static final CsvSchema CSV_SCHEMA = CSV.schemaFor(CsvRow.class).withHeader();

    /** One line of the circles file: {@code lat,lon,radius,area_id}. */
    @JsonPropertyOrder({"lat", "lon", "radius", "area_id"})
    record CsvRow(double lat, double lon, double radius, @JsonProperty("area_id") int areaId) {}

    public record StepPreview(double referenceLat, double latStep, double lonStep) {}

    private final PlannerProperties properties;

    public CoverageService(PlannerProperties properties) {
        this.properties = properties;
    }

    public CoverageResult cover(CoverageRequestDto dto) {
        List<Polygon> polygons = dto.getPolygons().stream()
            .map(vertices -> new Polygon(vertices.stream().map(PointDto::toLatLon).toList()))
            .toList();
        return cover(polygons, dto.getRadiusMeters(), dto.getSpacingFactor());
    }

    /**
     * @param radiusMeters  {@code null} for the configured default
     * @param spacingFactor {@code null} for the configured default
     */
    public CoverageResult cover(List<Polygon> polygons, Double radiusMeters, Double spacingFactor) {
        PlannerProperties.Coverage cfg = properties.getCoverage();
        CoverageRequest request = new CoverageRequest(
            polygons,
            radiusMeters != null ? radiusMeters : cfg.getDefaultRadiusMeters(),
            spacingFactor != null ? spacingFactor : cfg.getDefaultSpacingFactor());

        CoverageGenerator generator = new CoverageGenerator(request);
        generator.grid().ifPresent(grid -> checkGridSize(grid, cfg.getMaxGridCells()));

        long t0 = System.nanoTime();
        CoverageResult result = generator.generate();
        long micros = (System.nanoTime() - t0) / 1_000;

        if (result.hasNotice(PlanningNotice.NO_AREAS_PROVIDED)) {
            log.warn("Coverage requested without any area; returning no circles");
        } else {
            log.info("Generated {} circle center(s) for {} area(s), radius={}m spacing={} in {}us",
                result.size(), polygons.size(), request.radiusMeters(), request.spacingFactor(), micros);
        }
        return result;
    }

    /**
     * Degree steps a sweep would use at the given latitude, without sweeping anything.
     */
    public StepPreview stepPreview(double radiusMeters, double spacingFactor, double referenceLat) {
        // validates radius and spacing the same way a real sweep does
        CoverageRequest request = new CoverageRequest(List.of(), radiusMeters, spacingFactor);
        double latStep = CoverageGenerator.latStep(request.radiusMeters(), request.spacingFactor());
        double lonStep = CoverageGenerator.lonStep(request.radiusMeters(), request.spacingFactor(), referenceLat);
        return new StepPreview(referenceLat, latStep, lonStep);
    }

    public String toCsv(CoverageResult result) {
        List<CsvRow> rows = result.centers().stream()
            .map(c -> new CsvRow(c.lat(), c.lon(), c.radiusMeters(), c.areaId()))
            .toList();
        try {
            return CSV.writer(CSV_SCHEMA).writeValueAsString(rows);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render circle centers as CSV", e);
        }
    }

    private static void checkGridSize(GridSpec grid, long maxCells) {
        // rows * cols can overflow for absurd boxes; compare by division instead
        if (grid.rows() > maxCells / Math.max(1, grid.cols())) {
            throw new InvalidParameterException("sweep of " + grid.rows() + " x " + grid.cols()
                + " grid points exceeds the limit of " + maxCells + "; raise the radius or split the area");
        }
    }
}
