package com.factory.auth.domain.exception;

/**
 * Thrown when attempting to register with an email that already exists.
 * Mapped to 409 Conflict by GlobalExceptionHandler.
 */
public class UserAlreadyExistsException extends AuthException {

    public UserAlreadyExistsException() {
        super(ErrorCode.ALREADY_EXISTS, "User already exists");
    }

    public UserAlreadyExistsException(Throwable cause) {
        super(ErrorCode.ALREADY_EXISTS, "User already exists", cause);
    }
}
