package com.factory.auth.api.grpc;

import com.factory.auth.domain.exception.AuthException;
import com.factory.auth.domain.model.LoginResult;
import com.factory.auth.domain.model.TokenPair;
import com.factory.auth.domain.model.UserProfile;
import com.factory.auth.domain.service.CredentialService;
import com.factory.auth.grpc.v1.AuthServiceGrpc;
import com.factory.auth.grpc.v1.ErrorDetail;
import com.factory.auth.grpc.v1.GetUserProfileRequest;
import com.factory.auth.grpc.v1.GetUserProfileResponse;
import com.factory.auth.grpc.v1.LoginRequest;
import com.factory.auth.grpc.v1.LoginResponse;
import com.factory.auth.grpc.v1.RefreshTokenRequest;
import com.factory.auth.grpc.v1.RefreshTokenResponse;
import com.factory.auth.grpc.v1.RegisterRequest;
import com.factory.auth.grpc.v1.RegisterResponse;
import com.factory.auth.grpc.v1.User;
import com.factory.auth.grpc.v1.ValidateTokenRequest;
import com.factory.auth.grpc.v1.ValidateTokenResponse;
import io.grpc.stub.StreamObserver;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;

/**
 * gRPC front end over {@link CredentialService}.
 * <p>
 * 4xx failures are answered in the envelope with {@code success=false}; anything else is rethrown
 * for {@link GrpcExceptionInterceptor} to close the call.
 */
@Slf4j
public class AuthGrpcService extends AuthServiceGrpc.AuthServiceImplBase {

    private final CredentialService credentialService;

    public AuthGrpcService(CredentialService credentialService) {
        this.credentialService = credentialService;
    }

    @Override
    public void register(RegisterRequest request, StreamObserver<RegisterResponse> responseObserver) {
        RegisterResponse response;
        try {
            UserProfile user = credentialService.register(
                    request.getEmail(), request.getPassword(), request.getFirstName(), request.getLastName());
            response = RegisterResponse.newBuilder()
                    .setSuccess(true)
                    .setMessage("User registered successfully")
                    .setUser(toProto(user))
                    .build();
        } catch (AuthException e) {
            response = RegisterResponse.newBuilder()
                    .setSuccess(false)
                    .setMessage(e.getMessage())
                    .setError(clientError(e))
                    .build();
        }
        respond(responseObserver, response);
    }

    @Override
    public void login(LoginRequest request, StreamObserver<LoginResponse> responseObserver) {
        LoginResponse response;
        try {
            LoginResult result = credentialService.login(request.getEmail(), request.getPassword());
            response = LoginResponse.newBuilder()
                    .setSuccess(true)
                    .setMessage("Login successful")
                    .setUser(toProto(result.getUser()))
                    .setToken(result.getAccessToken())
                    .setRefreshToken(result.getRefreshToken())
                    .setExpiresIn(result.getExpiresIn())
                    .build();
        } catch (AuthException e) {
            response = LoginResponse.newBuilder()
                    .setSuccess(false)
                    .setMessage(e.getMessage())
                    .setError(clientError(e))
                    .build();
        }
        respond(responseObserver, response);
    }

    @Override
    public void validateToken(ValidateTokenRequest request,
                              StreamObserver<ValidateTokenResponse> responseObserver) {
        ValidateTokenResponse response;
        try {
            UserProfile user = credentialService.validateAccessToken(request.getToken());
            response = ValidateTokenResponse.newBuilder()
                    .setSuccess(true)
                    .setMessage("Token is valid")
                    .setUser(toProto(user))
                    .build();
        } catch (AuthException e) {
            response = ValidateTokenResponse.newBuilder()
                    .setSuccess(false)
                    .setMessage(e.getMessage())
                    .setError(clientError(e))
                    .build();
        }
        respond(responseObserver, response);
    }

    @Override
    public void refreshToken(RefreshTokenRequest request,
                             StreamObserver<RefreshTokenResponse> responseObserver) {
        RefreshTokenResponse response;
        try {
            TokenPair tokens = credentialService.refreshAccessToken(request.getRefreshToken());
            response = RefreshTokenResponse.newBuilder()
                    .setSuccess(true)
                    .setMessage("Token refreshed successfully")
                    .setToken(tokens.getAccessToken())
                    .setRefreshToken(tokens.getRefreshToken())
                    .setExpiresIn(tokens.getExpiresIn())
                    .build();
        } catch (AuthException e) {
            response = RefreshTokenResponse.newBuilder()
                    .setSuccess(false)
                    .setMessage(e.getMessage())
                    .setError(clientError(e))
                    .build();
        }
        respond(responseObserver, response);
    }

    @Override
    public void getUserProfile(GetUserProfileRequest request,
                               StreamObserver<GetUserProfileResponse> responseObserver) {
        GetUserProfileResponse response;
        try {
            UserProfile user = credentialService.getProfile(request.getUserId());
            response = GetUserProfileResponse.newBuilder()
                    .setSuccess(true)
                    .setMessage("User profile retrieved successfully")
                    .setUser(toProto(user))
                    .build();
        } catch (AuthException e) {
            response = GetUserProfileResponse.newBuilder()
                    .setSuccess(false)
                    .setMessage(e.getMessage())
                    .setError(clientError(e))
                    .build();
        }
        respond(responseObserver, response);
    }

    /**
     * Envelope error for a business failure; backend failures are rethrown untouched.
     */
    private static ErrorDetail clientError(AuthException e) {
        if (!e.getErrorCode().isClientError()) {
            throw e;
        }
        log.debug("[GRPC_BUSINESS_ERROR] Call answered with error envelope | code={}", e.getErrorCode());
        return ErrorDetail.newBuilder()
                .setCode(e.getErrorCode().toString())
                .setMessage(e.getMessage())
                .build();
    }

    private static <T> void respond(StreamObserver<T> responseObserver, T response) {
        responseObserver.onNext(response);
        responseObserver.onCompleted();
    }

    private static User toProto(UserProfile user) {
        return User.newBuilder()
                .setId(user.getId())
                .setEmail(user.getEmail())
                .setFirstName(nullToEmpty(user.getFirstName()))
                .setLastName(nullToEmpty(user.getLastName()))
                .setActive(user.isActive())
                .setCreatedAt(epochSeconds(user.getCreatedAt()))
                .setUpdatedAt(epochSeconds(user.getUpdatedAt()))
                .build();
    }

    private static long epochSeconds(Instant instant) {
        return instant == null ? 0L : instant.getEpochSecond();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
