package com.factory.auth.domain.exception;

/**
 * Thrown when the user directory or the session store cannot be reached, times out, or breaks its
 * contract. The cause is logged server-side; clients get a generic message.
 */
public class BackendUnavailableException extends AuthException {

    public static BackendUnavailableException directory(Throwable cause) {
        return new BackendUnavailableException(ErrorCode.DATABASE_ERROR, cause);
    }

    public static BackendUnavailableException sessionStore(Throwable cause) {
        return new BackendUnavailableException(ErrorCode.SERVICE_UNAVAILABLE, cause);
    }

    private BackendUnavailableException(ErrorCode errorCode, Throwable cause) {
        super(errorCode, "Something went wrong. Please try again later.", cause);
    }
}
