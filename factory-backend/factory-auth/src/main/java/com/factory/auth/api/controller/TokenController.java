package com.factory.auth.api.controller;

import com.factory.auth.api.dto.ApiResponse;
import com.factory.auth.api.dto.TokenRefreshRequestDto;
import com.factory.auth.api.dto.TokenRefreshResponseDto;
import com.factory.auth.api.dto.UserDto;
import com.factory.auth.api.dto.UserResponseDto;
import com.factory.auth.domain.model.AuthenticatedPrincipal;
import com.factory.auth.domain.model.TokenPair;
import com.factory.auth.domain.service.CredentialService;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Token Controller - Token Lifecycle Management
 *
 * Endpoints:
 * - POST /api/v1/auth/refresh
 * - GET  /api/v1/auth/validate
 */
@RestController
@RequestMapping("/api/v1/auth")
@Tag(name = "Token Management", description = "Token refresh and validation")
public class TokenController {

    private final CredentialService credentialService;

    public TokenController(CredentialService credentialService) {
        this.credentialService = credentialService;
    }

    /**
     * Exchange a refresh token for a new ACCESS token
     */
    @PostMapping("/refresh")
    public ResponseEntity<ApiResponse<TokenRefreshResponseDto>> refreshToken(
            @Valid @RequestBody TokenRefreshRequestDto request) {
        TokenPair tokens = credentialService.refreshAccessToken(request.getRefreshToken());
        TokenRefreshResponseDto response = new TokenRefreshResponseDto(
                tokens.getAccessToken(), tokens.getRefreshToken(), tokens.getExpiresIn());
        return ResponseEntity.ok(ApiResponse.success(response, "Token refreshed successfully"));
    }

    /**
     * The principal is resolved from the bearer token; reaching this method means the token is valid
     * and its profile is the one validation loaded
     */
    @GetMapping("/validate")
    public ResponseEntity<ApiResponse<UserResponseDto>> validate(AuthenticatedPrincipal principal) {
        UserDto user = UserDto.from(principal.getProfile());
        return ResponseEntity.ok(ApiResponse.success(new UserResponseDto(user), "Token is valid"));
    }
}
