package com.tazifor.planner.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Getter;

/**
 * Error envelope returned by {@link com.tazifor.planner.exception.ApiExceptionHandler}.
 */
@Getter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {
    private boolean success;
    private T data;
    private String error;
    private String code;
    private String message;

    public static <T> ApiResponse<T> error(String error, String code, String message) {
        ApiResponse<T> resp = new ApiResponse<>();
        resp.success = false;
        resp.error = error;
        resp.code = code;
        resp.message = message;
        return resp;
    }
}
