package com.factory.auth.api.grpc;

import com.factory.auth.domain.constants.AuthConstants;
import com.factory.auth.domain.exception.AuthException;
import com.factory.auth.domain.exception.ErrorCode;
import io.grpc.ForwardingServerCallListener;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import lombok.extern.slf4j.Slf4j;

/**
 * gRPC server interceptor that turns exceptions escaping a handler into a proper status.
 *
 * <p>Business failures never get here: {@link AuthGrpcService} answers them in the response
 * envelope. What does arrive is a backend failure or a bug. The client sees a generic description
 * and the stable error code in the {@code x-error-code} trailer; the cause is logged here.
 */
@Slf4j
public class GrpcExceptionInterceptor implements ServerInterceptor {

    static final Metadata.Key<String> ERROR_CODE_KEY =
            Metadata.Key.of(AuthConstants.GRPC_ERROR_CODE_KEY, Metadata.ASCII_STRING_MARSHALLER);

    @Override
    public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(
            ServerCall<ReqT, RespT> call, Metadata headers, ServerCallHandler<ReqT, RespT> next) {

        ServerCall.Listener<ReqT> delegate = next.startCall(call, headers);

        return new ForwardingServerCallListener.SimpleForwardingServerCallListener<ReqT>(delegate) {
            @Override
            public void onHalfClose() {
                try {
                    super.onHalfClose();
                } catch (RuntimeException e) {
                    Metadata trailers = new Metadata();
                    Status status = mapException(e, trailers);
                    log.error("[GRPC_CALL_FAILED] Call closed with error | method={} | status={}",
                            call.getMethodDescriptor().getFullMethodName(), status.getCode(), e);
                    call.close(status, trailers);
                }
            }
        };
    }

    /** Maps a Java exception to a gRPC Status. Package-private for testing. */
    Status mapException(Throwable throwable, Metadata trailers) {
        if (throwable instanceof StatusRuntimeException) {
            return ((StatusRuntimeException) throwable).getStatus();
        }
        if (throwable instanceof AuthException) {
            ErrorCode code = ((AuthException) throwable).getErrorCode();
            trailers.put(ERROR_CODE_KEY, code.toString());
            return statusFor(code).withDescription(throwable.getMessage());
        }
        trailers.put(ERROR_CODE_KEY, ErrorCode.INTERNAL_ERROR.toString());
        return Status.INTERNAL.withDescription("Internal server error");
    }

    private static Status statusFor(ErrorCode code) {
        switch (code) {
            case UNAUTHORIZED:
            case INVALID_TOKEN:
            case EXPIRED_TOKEN:
                return Status.UNAUTHENTICATED;
            case FORBIDDEN:
                return Status.PERMISSION_DENIED;
            case NOT_FOUND:
                return Status.NOT_FOUND;
            case VALIDATION_ERROR:
            case BAD_REQUEST:
                return Status.INVALID_ARGUMENT;
            case ALREADY_EXISTS:
            case CONFLICT:
                return Status.ALREADY_EXISTS;
            case SERVICE_UNAVAILABLE:
                return Status.UNAVAILABLE;
            default:
                return Status.INTERNAL;
        }
    }
}
