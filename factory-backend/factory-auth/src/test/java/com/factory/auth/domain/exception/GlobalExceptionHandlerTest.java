package com.factory.auth.domain.exception;

import com.factory.auth.api.dto.ApiResponse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.core.MethodParameter;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

import java.lang.reflect.Method;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("GlobalExceptionHandler")
class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();
    private final MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/auth/profile");

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @SuppressWarnings("unused")
    private static void withHeader(String value) {
    }

    @Test
    @DisplayName("answers a missing request header with 400 BAD_REQUEST")
    void handlesMissingHeader() throws Exception {
        Method method = GlobalExceptionHandlerTest.class.getDeclaredMethod("withHeader", String.class);
        MissingRequestHeaderException ex =
                new MissingRequestHeaderException("X-Tenant", MethodParameter.forExecutable(method, 0));

        ResponseEntity<ApiResponse<Void>> response = handler.handleProtocol(ex, request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().getError().getCode()).isEqualTo("BAD_REQUEST");
    }

    @Test
    @DisplayName("keeps other Spring MVC client errors out of INTERNAL_ERROR")
    void keepsClientErrorsOutOfCatchAll() {
        ResponseEntity<ApiResponse<Void>> response =
                handler.handleGeneric(new MaxUploadSizeExceededException(1024), request);

        assertThat(response.getStatusCode().value()).isEqualTo(413);
        assertThat(response.getBody().getError().getCode()).isEqualTo("BAD_REQUEST");
    }

    @Test
    @DisplayName("answers an unexpected exception with 500 and the current request id")
    void hidesUnexpectedFailure() {
        MDC.put("requestId", "req-7");

        ResponseEntity<ApiResponse<Void>> response =
                handler.handleGeneric(new IllegalStateException("boom"), request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().getError().getCode()).isEqualTo("INTERNAL_ERROR");
        assertThat(response.getBody().getError().getMessage())
                .isEqualTo("Something went wrong. Please try again later.");
        assertThat(response.getBody().getError().getRequestId()).isEqualTo("req-7");
    }
}
