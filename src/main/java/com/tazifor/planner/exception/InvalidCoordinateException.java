package com.tazifor.planner.exception;

public class InvalidCoordinateException extends PlannerValidationException {
    public InvalidCoordinateException(String message) {
        super(ErrorCode.INVALID_COORDINATE, message);
    }
}
