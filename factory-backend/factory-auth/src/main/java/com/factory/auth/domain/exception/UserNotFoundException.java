package com.factory.auth.domain.exception;

/**
 * Thrown when a user id does not resolve to an active user.
 * Mapped to 404 Not Found by GlobalExceptionHandler.
 */
public class UserNotFoundException extends AuthException {

    public UserNotFoundException() {
        super(ErrorCode.NOT_FOUND, "User not found");
    }
}
