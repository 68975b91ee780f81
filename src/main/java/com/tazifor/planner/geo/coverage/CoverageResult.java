package com.tazifor.planner.geo.coverage;

import com.tazifor.planner.exception.PlanningNotice;
import com.tazifor.planner.geo.model.CircleCenter;
import com.tazifor.planner.geo.model.GridSpec;

import java.util.List;
import java.util.Optional;

/**
 * Output of one coverage sweep.
 *
 * @param centers circle centers in sweep order (south to north, west to east)
 * @param grid    the lattice that was swept; {@code null} when there was nothing to sweep
 * @param notices non-fatal conditions met along the way
 */
public record CoverageResult(List<CircleCenter> centers, GridSpec grid, List<PlanningNotice> notices) {

    public CoverageResult {
        centers = List.copyOf(centers);
        notices = List.copyOf(notices);
    }

    static CoverageResult noAreas() {
        return new CoverageResult(List.of(), null, List.of(PlanningNotice.NO_AREAS_PROVIDED));
    }

    public Optional<GridSpec> gridSpec() {
        return Optional.ofNullable(grid);
    }

    public boolean hasNotice(PlanningNotice notice) {
        return notices.contains(notice);
    }

    public int size() {
        return centers.size();
    }
}
