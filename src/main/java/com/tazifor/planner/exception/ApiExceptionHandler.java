package com.tazifor.planner.exception;

import com.tazifor.planner.dto.ApiResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.TypeMismatchException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.ServletRequestBindingException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps rejected input to 400 and everything else to 500.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    /** Body text for 500s; the cause stays in the server log. */
    static final String UNEXPECTED_ERROR_MESSAGE = "Unexpected error while processing the request";

    @ExceptionHandler(PlannerValidationException.class)
    public ResponseEntity<ApiResponse<Void>> handlePlannerValidation(PlannerValidationException ex) {
        log.debug("Rejected request: {} {}", ex.code(), ex.getMessage());
        return ResponseEntity.badRequest()
            .body(ApiResponse.error("Invalid request", ex.code().name(), ex.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(err -> err.getField() + " " + err.getDefaultMessage())
            .orElse("Validation failed");
        return ResponseEntity.badRequest()
            .body(ApiResponse.error("Invalid request", ErrorCode.INVALID_PARAMETER.name(), message));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Void>> handleUnreadable(HttpMessageNotReadableException ex) {
        return ResponseEntity.badRequest()
            .body(ApiResponse.error("Invalid request", ErrorCode.INVALID_PARAMETER.name(), "Malformed request body"));
    }

    @ExceptionHandler({ServletRequestBindingException.class, TypeMismatchException.class})
    public ResponseEntity<ApiResponse<Void>> handleBadParameter(Exception ex) {
        return ResponseEntity.badRequest()
            .body(ApiResponse.error("Invalid request", ErrorCode.INVALID_PARAMETER.name(), ex.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse<Void>> handleIllegalArgument(IllegalArgumentException ex) {
        return ResponseEntity.badRequest()
            .body(ApiResponse.error("Invalid request", ErrorCode.INVALID_PARAMETER.name(), ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleGeneric(Exception ex) {
        log.error("Unhandled error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(ApiResponse.error("Internal server error", null, UNEXPECTED_ERROR_MESSAGE));
    }
}
