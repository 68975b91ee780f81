package com.tazifor.planner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Lokal Planner - search-area coverage and itinerary sequencing.
 *
 * Two engines behind a thin REST layer:
 * - Coverage: tiles target areas with search circles for a nearby-search API
 * - Route: orders scored destinations into a greedy visiting sequence
 *
 * Both are pure, in-memory computations; the service holds no state between requests.
 */
@SpringBootApplication
public class PlannerApplication {

    public static void main(String[] args) {
        SpringApplication.run(PlannerApplication.class, args);
    }
}
