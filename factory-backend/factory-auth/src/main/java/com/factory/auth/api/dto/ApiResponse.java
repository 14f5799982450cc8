package com.factory.auth.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Envelope for every HTTP response.
 *
 * Example:
 * {
 *   "success": false,
 *   "error": { "code": "ALREADY_EXISTS", "message": "User already exists" }
 * }
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    private final boolean success;
    private final T data;
    private final ErrorInfo error;
    private final String message;

    private ApiResponse(boolean success, T data, ErrorInfo error, String message) {
        this.success = success;
        this.data = data;
        this.error = error;
        this.message = message;
    }

    public static <T> ApiResponse<T> success(T data, String message) {
        return new ApiResponse<>(true, data, null, message);
    }

    public static <T> ApiResponse<T> failure(ErrorInfo error) {
        return new ApiResponse<>(false, null, error, null);
    }

    // Getters
    public boolean isSuccess() {
        return success;
    }

    public T getData() {
        return data;
    }

    public ErrorInfo getError() {
        return error;
    }

    public String getMessage() {
        return message;
    }
}
