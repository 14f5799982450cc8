package com.factory.auth.domain.exception;

/**
 * Base of every failure the credential service reports. The message is the fixed client-facing text;
 * internal detail only ever travels in the cause.
 */
public abstract class AuthException extends RuntimeException {

    private final ErrorCode errorCode;

    protected AuthException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected AuthException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
