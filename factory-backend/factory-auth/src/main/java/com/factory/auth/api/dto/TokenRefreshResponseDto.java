package com.factory.auth.api.dto;

public class TokenRefreshResponseDto {

    private final String token;            // New ACCESS token
    private final String refreshToken;     // Rotated refresh token, or the presented one
    private final long expiresIn;

    public TokenRefreshResponseDto(String token, String refreshToken, long expiresIn) {
        this.token = token;
        this.refreshToken = refreshToken;
        this.expiresIn = expiresIn;
    }

    // Getters
    public String getToken() {
        return token;
    }

    public String getRefreshToken() {
        return refreshToken;
    }

    public long getExpiresIn() {
        return expiresIn;
    }
}
