package com.factory.auth.api.controller;

import com.factory.auth.config.SecurityConfig;
import com.factory.auth.domain.exception.BackendUnavailableException;
import com.factory.auth.domain.exception.InvalidCredentialsException;
import com.factory.auth.domain.model.LoginResult;
import com.factory.auth.domain.service.CredentialService;
import com.factory.auth.support.Fixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(LoginController.class)
@Import(SecurityConfig.class)
@DisplayName("POST /api/v1/auth/login")
class LoginControllerTest {

    private static final String BODY = """
            {"email":"a@x.com","password":"pw123456"}
            """;

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private CredentialService credentialService;

    @Test
    @DisplayName("returns 200 with both tokens and the user")
    void logsIn() throws Exception {
        given(credentialService.login("a@x.com", "pw123456"))
                .willReturn(new LoginResult(Fixtures.profile(), "access", "refresh", 900));

        mockMvc.perform(post("/api/v1/auth/login").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.message").value("Login successful"))
                .andExpect(jsonPath("$.data.token").value("access"))
                .andExpect(jsonPath("$.data.refresh_token").value("refresh"))
                .andExpect(jsonPath("$.data.expires_in").value(900))
                .andExpect(jsonPath("$.data.user.email").value("a@x.com"));
    }

    @Test
    @DisplayName("returns 401 UNAUTHORIZED for bad credentials")
    void rejectsBadCredentials() throws Exception {
        given(credentialService.login("a@x.com", "pw123456")).willThrow(new InvalidCredentialsException());

        mockMvc.perform(post("/api/v1/auth/login").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("UNAUTHORIZED"))
                .andExpect(jsonPath("$.error.message").value("Invalid email or password"));
    }

    @Test
    @DisplayName("returns 503 SERVICE_UNAVAILABLE when the session store is down")
    void reportsStoreOutage() throws Exception {
        given(credentialService.login("a@x.com", "pw123456"))
                .willThrow(BackendUnavailableException.sessionStore(new RedisConnectionFailureException("refused")));

        mockMvc.perform(post("/api/v1/auth/login").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error.code").value("SERVICE_UNAVAILABLE"))
                .andExpect(jsonPath("$.error.message").value("Something went wrong. Please try again later."));
    }

    @Test
    @DisplayName("returns 500 INTERNAL_ERROR for an unexpected exception")
    void hidesUnexpectedErrors() throws Exception {
        given(credentialService.login("a@x.com", "pw123456")).willThrow(new IllegalStateException("boom"));

        mockMvc.perform(post("/api/v1/auth/login").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error.code").value("INTERNAL_ERROR"))
                .andExpect(jsonPath("$.error.message").value("Something went wrong. Please try again later."));
    }

    @Test
    @DisplayName("returns 415 BAD_REQUEST for a body that is not JSON typed")
    void rejectsUnsupportedMediaType() throws Exception {
        mockMvc.perform(post("/api/v1/auth/login").contentType(MediaType.TEXT_PLAIN).content(BODY))
                .andExpect(status().isUnsupportedMediaType())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("BAD_REQUEST"))
                .andExpect(jsonPath("$.error.message").value("Unsupported Media Type"));
        verifyNoInteractions(credentialService);
    }

    @Test
    @DisplayName("returns 405 BAD_REQUEST with an Allow header for the wrong method")
    void rejectsWrongMethod() throws Exception {
        mockMvc.perform(get("/api/v1/auth/login"))
                .andExpect(status().isMethodNotAllowed())
                .andExpect(header().string(HttpHeaders.ALLOW, "POST"))
                .andExpect(jsonPath("$.error.code").value("BAD_REQUEST"))
                .andExpect(jsonPath("$.error.message").value("Method Not Allowed"));
        verifyNoInteractions(credentialService);
    }

    @Test
    @DisplayName("echoes the caller's X-Request-ID on the response and in the error body")
    void echoesRequestId() throws Exception {
        given(credentialService.login("a@x.com", "pw123456")).willThrow(new InvalidCredentialsException());

        mockMvc.perform(post("/api/v1/auth/login")
                        .header("X-Request-ID", "req-42")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isUnauthorized())
                .andExpect(header().string("X-Request-ID", "req-42"))
                .andExpect(jsonPath("$.error.request_id").value("req-42"));
    }

    @Test
    @DisplayName("generates a request id when the caller sends none")
    void generatesRequestId() throws Exception {
        mockMvc.perform(post("/api/v1/auth/login").contentType(MediaType.APPLICATION_JSON).content("{oops"))
                .andExpect(status().isBadRequest())
                .andExpect(header().exists("X-Request-ID"))
                .andExpect(jsonPath("$.error.request_id").isNotEmpty());
    }
}
