package com.tazifor.planner.exception;

public class InvalidParameterException extends PlannerValidationException {
    public InvalidParameterException(String message) {
        super(ErrorCode.INVALID_PARAMETER, message);
    }
}
