package com.factory.auth.domain.exception;

/**
 * Thrown when a protected call arrives without a bearer token.
 * Mapped to 401 Unauthorized by GlobalExceptionHandler.
 */
public class MissingCredentialsException extends AuthException {

    public MissingCredentialsException() {
        super(ErrorCode.UNAUTHORIZED, "Authorization header required");
    }
}
