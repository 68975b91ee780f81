package com.tazifor.planner.exception;

public class InvalidIndicatorException extends PlannerValidationException {
    public InvalidIndicatorException(String message) {
        super(ErrorCode.INVALID_INDICATOR, message);
    }
}
