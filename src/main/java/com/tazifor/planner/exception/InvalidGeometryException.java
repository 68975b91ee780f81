package com.tazifor.planner.exception;

public class InvalidGeometryException extends PlannerValidationException {
    public InvalidGeometryException(String message) {
        super(ErrorCode.INVALID_GEOMETRY, message);
    }
}
