package com.factory.auth.domain.exception;

/**
 * Thrown when a required argument is missing or blank.
 * Mapped to 400 Bad Request by GlobalExceptionHandler.
 */
public class RequestValidationException extends AuthException {

    public RequestValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }
}
