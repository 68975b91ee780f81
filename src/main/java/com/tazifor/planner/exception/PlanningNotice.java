package com.tazifor.planner.exception;

/**
 * Non-fatal "nothing to do" conditions. Reported alongside an empty result, never thrown.
 */
public enum PlanningNotice {
    /** Coverage was requested for zero polygons. */
    NO_AREAS_PROVIDED,
    /** Route sequencing started with no candidates. */
    EMPTY_CANDIDATE_POOL
}
