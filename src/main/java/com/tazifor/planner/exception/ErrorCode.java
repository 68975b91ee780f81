package com.tazifor.planner.exception;

/**
 * Machine-readable category of a rejected planning input.
 */
public enum ErrorCode {
    INVALID_GEOMETRY,
    INVALID_PARAMETER,
    INVALID_COORDINATE,
    INVALID_INDICATOR
}
