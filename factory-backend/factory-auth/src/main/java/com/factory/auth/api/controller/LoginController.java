package com.factory.auth.api.controller;

import com.factory.auth.api.dto.ApiResponse;
import com.factory.auth.api.dto.LoginRequestDto;
import com.factory.auth.api.dto.LoginResponseDto;
import com.factory.auth.api.dto.UserDto;
import com.factory.auth.domain.model.LoginResult;
import com.factory.auth.domain.service.CredentialService;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/auth")
@Tag(name = "Authentication", description = "Password login")
public class LoginController {

    private final CredentialService credentialService;

    public LoginController(CredentialService credentialService) {
        this.credentialService = credentialService;
    }

    @PostMapping("/login")
    public ResponseEntity<ApiResponse<LoginResponseDto>> login(@Valid @RequestBody LoginRequestDto request) {
        LoginResult result = credentialService.login(request.getEmail(), request.getPassword());
        LoginResponseDto response = new LoginResponseDto(
                result.getAccessToken(),
                result.getRefreshToken(),
                result.getExpiresIn(),
                UserDto.from(result.getUser())
        );
        return ResponseEntity.ok(ApiResponse.success(response, "Login successful"));
    }
}
