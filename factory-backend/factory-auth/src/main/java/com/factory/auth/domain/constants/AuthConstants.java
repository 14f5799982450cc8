package com.factory.auth.domain.constants;

public final class AuthConstants {

    // Private constructor prevents instantiation
    private AuthConstants() {
        throw new UnsupportedOperationException("This is a utility class and cannot be instantiated");
    }

    public static final int DEFAULT_BCRYPT_COST_FACTOR = 10;
    public static final int MIN_SECRET_BYTE_LENGTH = 32;
    public static final int MIN_PASSWORD_LENGTH = 6;
    // BCrypt reads at most this many bytes of a password
    public static final int MAX_PASSWORD_BYTES = 72;

    public static final String CLAIM_EMAIL = "email";

    // Redis Key Prefixes
    public static final String REDIS_REFRESH_TOKEN_PREFIX = "refresh_token:";

    // gRPC trailer carrying the ErrorCode of a failed call
    public static final String GRPC_ERROR_CODE_KEY = "x-error-code";

    // Request correlation
    public static final String REQUEST_ID_HEADER = "X-Request-ID";
    public static final String REQUEST_ID_MDC_KEY = "requestId";
}
