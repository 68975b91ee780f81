package com.tazifor.planner.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Planner settings bound from {@code planner.*}.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "planner")
public class PlannerProperties {

    private final Coverage coverage = new Coverage();
    private final Route route = new Route();

    @Data
    public static class Coverage {
        /** Circle radius used when a request does not name one. */
        private double defaultRadiusMeters = 500;
        /** Spacing factor used when a request does not name one. */
        private double defaultSpacingFactor = 0.5;
        /** Largest rows x cols sweep the HTTP endpoints will run. */
        private long maxGridCells = 2_000_000;
    }

    @Data
    public static class Route {
        private int defaultStops = 5;
        private int maxCandidates = 10_000;
    }
}
