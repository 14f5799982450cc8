package com.factory.auth.domain.exception;

import com.factory.auth.api.dto.ApiResponse;
import com.factory.auth.api.dto.ErrorInfo;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.ServletRequestBindingException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import static com.factory.auth.domain.constants.AuthConstants.REQUEST_ID_MDC_KEY;

/**
 * Global exception handler for all REST controllers.
 * Maps exceptions to the ApiResponse envelope with the HTTP status their ErrorCode carries.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    static final String GENERIC_MESSAGE = "Something went wrong. Please try again later.";

    /**
     * Handle validation errors from @Valid annotations
     * Returns 400 Bad Request
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult()
                .getFieldErrors()
                .stream()
                .findFirst()
                .map(err -> err.getDefaultMessage())
                .orElse("Invalid request");

        return respond(ErrorCode.VALIDATION_ERROR, message);
    }

    /**
     * Handle bodies that are not valid JSON
     * Returns 400 Bad Request
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Void>> handleUnreadable(HttpMessageNotReadableException ex) {
        log.debug("[REQUEST_UNREADABLE] Request body rejected | error={}", ex.getMessage());
        return respond(ErrorCode.BAD_REQUEST, "Invalid request body");
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ApiResponse<Void>> handleNoResource(NoResourceFoundException ex) {
        return respond(ErrorCode.NOT_FOUND, "Resource not found");
    }

    /**
     * Handle requests Spring MVC refuses before a controller runs: wrong method (405), unsupported
     * content type (415), missing header or parameter (400). The status and headers such as
     * {@code Allow} come from the exception; the envelope code is BAD_REQUEST.
     */
    @ExceptionHandler({
            HttpRequestMethodNotSupportedException.class,
            HttpMediaTypeNotSupportedException.class,
            ServletRequestBindingException.class
    })
    public ResponseEntity<ApiResponse<Void>> handleProtocol(Exception ex, HttpServletRequest request) {
        return respondToProtocolError((ErrorResponse) ex, request);
    }

    /**
     * Handle every domain failure. 4xx codes are reported verbatim;
     * 5xx codes are logged with their cause and answered with a generic message.
     */
    @ExceptionHandler(AuthException.class)
    public ResponseEntity<ApiResponse<Void>> handleAuth(AuthException ex, HttpServletRequest request) {
        ErrorCode code = ex.getErrorCode();
        if (code.isClientError()) {
            log.debug("[REQUEST_REJECTED] {} {} | code={}", request.getMethod(), request.getRequestURI(), code);
            return respond(code, ex.getMessage());
        }
        log.error("[REQUEST_FAILED] {} {} | code={}", request.getMethod(), request.getRequestURI(), code, ex);
        return respond(code, GENERIC_MESSAGE);
    }

    /**
     * Handle unexpected errors
     * Returns 500 Internal Server Error
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleGeneric(Exception ex, HttpServletRequest request) {
        if (ex instanceof ErrorResponse && ((ErrorResponse) ex).getStatusCode().is4xxClientError()) {
            return respondToProtocolError((ErrorResponse) ex, request);
        }
        log.error("[UNEXPECTED_ERROR] {} {}", request.getMethod(), request.getRequestURI(), ex);
        return respond(ErrorCode.INTERNAL_ERROR, GENERIC_MESSAGE);
    }

    private static ResponseEntity<ApiResponse<Void>> respondToProtocolError(ErrorResponse ex,
                                                                            HttpServletRequest request) {
        HttpStatusCode status = ex.getStatusCode();
        HttpStatus resolved = HttpStatus.resolve(status.value());
        String message = resolved != null ? resolved.getReasonPhrase() : "Invalid request";
        log.debug("[REQUEST_REJECTED] {} {} | status={} | code={}",
                request.getMethod(), request.getRequestURI(), status.value(), ErrorCode.BAD_REQUEST);

        HttpHeaders headers = new HttpHeaders();
        headers.addAll(ex.getHeaders());
        return ResponseEntity
                .status(status)
                .headers(headers)
                .body(ApiResponse.failure(errorInfo(ErrorCode.BAD_REQUEST, message)));
    }

    private static ResponseEntity<ApiResponse<Void>> respond(ErrorCode code, String message) {
        return ResponseEntity
                .status(HttpStatus.valueOf(code.getHttpStatus()))
                .body(ApiResponse.failure(errorInfo(code, message)));
    }

    private static ErrorInfo errorInfo(ErrorCode code, String message) {
        return new ErrorInfo(code.toString(), message, MDC.get(REQUEST_ID_MDC_KEY));
    }
}
