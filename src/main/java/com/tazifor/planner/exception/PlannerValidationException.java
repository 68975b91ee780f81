package com.tazifor.planner.exception;

/**
 * Base type for inputs rejected before any computation starts.
 * <p>
 * Extends {@link IllegalArgumentException} so callers that only care about
 * "bad argument" keep working; the {@link ErrorCode} tells the categories apart.
 * </p>
 */
public abstract class PlannerValidationException extends IllegalArgumentException {

    private final ErrorCode code;

    protected PlannerValidationException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public ErrorCode code() {
        return code;
    }
}
