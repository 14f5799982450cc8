package com.factory.auth.api.controller;

import com.factory.auth.api.dto.ApiResponse;
import com.factory.auth.api.dto.RegistrationRequestDto;
import com.factory.auth.api.dto.UserDto;
import com.factory.auth.api.dto.UserResponseDto;
import com.factory.auth.domain.model.UserProfile;
import com.factory.auth.domain.service.CredentialService;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Registration Controller
 *
 * Endpoints:
 * - POST /api/v1/auth/register
 */
@RestController
@RequestMapping("/api/v1/auth")
@Tag(name = "Registration", description = "User registration")
public class RegistrationController {

    private final CredentialService credentialService;

    public RegistrationController(CredentialService credentialService) {
        this.credentialService = credentialService;
    }

    /**
     * Register a new user
     * Returns 201 Created with the public user view
     */
    @PostMapping("/register")
    public ResponseEntity<ApiResponse<UserResponseDto>> register(
            @Valid @RequestBody RegistrationRequestDto request) {
        UserProfile user = credentialService.register(
                request.getEmail(), request.getPassword(), request.getFirstName(), request.getLastName());
        return ResponseEntity
                .status(HttpStatus.CREATED)
                .body(ApiResponse.success(new UserResponseDto(UserDto.from(user)), "User registered successfully"));
    }
}
