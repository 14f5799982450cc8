package com.factory.auth.domain.exception;

/**
 * Thrown when login credentials are invalid.
 * Unknown email, inactive account and wrong password all produce this same exception and message.
 * Mapped to 401 Unauthorized by GlobalExceptionHandler.
 */
public class InvalidCredentialsException extends AuthException {

    public static final String MESSAGE = "Invalid email or password";

    public InvalidCredentialsException() {
        super(ErrorCode.UNAUTHORIZED, MESSAGE);
    }
}
