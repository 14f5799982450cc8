package com.factory.auth.domain.exception;

/**
 * Stable, client-visible error codes. Each code owns the HTTP status it maps to, so both transports
 * classify a failure the same way.
 */
public enum ErrorCode {
    UNAUTHORIZED("UNAUTHORIZED", 401),
    INVALID_TOKEN("INVALID_TOKEN", 401),
    EXPIRED_TOKEN("EXPIRED_TOKEN", 401),
    FORBIDDEN("FORBIDDEN", 403),
    NOT_FOUND("NOT_FOUND", 404),
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    ALREADY_EXISTS("ALREADY_EXISTS", 409),
    CONFLICT("CONFLICT", 409),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    DATABASE_ERROR("DATABASE_ERROR", 500),
    SERVICE_UNAVAILABLE("SERVICE_UNAVAILABLE", 503);

    private final String value;
    private final int httpStatus;

    ErrorCode(String value, int httpStatus) {
        this.value = value;
        this.httpStatus = httpStatus;
    }

    public int getHttpStatus() {
        return httpStatus;
    }

    /**
     * Business-rule failures are reported to the caller verbatim; everything else is a server fault.
     */
    public boolean isClientError() {
        return httpStatus < 500;
    }

    @Override
    public String toString() {
        return value;
    }
}
