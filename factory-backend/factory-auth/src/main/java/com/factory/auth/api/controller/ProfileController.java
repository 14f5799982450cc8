package com.factory.auth.api.controller;

import com.factory.auth.api.dto.ApiResponse;
import com.factory.auth.api.dto.UserDto;
import com.factory.auth.api.dto.UserResponseDto;
import com.factory.auth.domain.model.AuthenticatedPrincipal;
import com.factory.auth.domain.service.CredentialService;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/auth")
@Tag(name = "Profile", description = "Current user profile")
public class ProfileController {

    private final CredentialService credentialService;

    public ProfileController(CredentialService credentialService) {
        this.credentialService = credentialService;
    }

    @GetMapping("/profile")
    public ResponseEntity<ApiResponse<UserResponseDto>> profile(AuthenticatedPrincipal principal) {
        UserDto user = UserDto.from(credentialService.getProfile(principal.getUserId()));
        return ResponseEntity.ok(ApiResponse.success(new UserResponseDto(user), "User profile retrieved successfully"));
    }
}
