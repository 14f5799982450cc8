package com.factory.auth.domain.exception;

/**
 * Thrown when a token cannot be accepted. The reason is kept for logging and tests;
 * callers only ever see the code and the fixed message for it.
 * Mapped to 401 Unauthorized by GlobalExceptionHandler.
 */
public class InvalidTokenException extends AuthException {

    public enum Reason {
        MALFORMED,
        EXPIRED,
        SIGNATURE_MISMATCH,
        SUPERSEDED
    }

    private final Reason reason;

    public InvalidTokenException(Reason reason) {
        super(codeFor(reason), messageFor(reason));
        this.reason = reason;
    }

    public InvalidTokenException(Reason reason, Throwable cause) {
        super(codeFor(reason), messageFor(reason), cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    private static ErrorCode codeFor(Reason reason) {
        return reason == Reason.EXPIRED ? ErrorCode.EXPIRED_TOKEN : ErrorCode.INVALID_TOKEN;
    }

    private static String messageFor(Reason reason) {
        return reason == Reason.EXPIRED ? "Token has expired" : "Invalid token";
    }
}
