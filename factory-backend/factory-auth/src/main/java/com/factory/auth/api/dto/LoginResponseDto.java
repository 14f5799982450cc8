package com.factory.auth.api.dto;

public class LoginResponseDto {

    private final String token;          // ACCESS token
    private final String refreshToken;
    private final long expiresIn;        // ACCESS token lifetime in seconds
    private final UserDto user;

    public LoginResponseDto(String token, String refreshToken, long expiresIn, UserDto user) {
        this.token = token;
        this.refreshToken = refreshToken;
        this.expiresIn = expiresIn;
        this.user = user;
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

    public UserDto getUser() {
        return user;
    }
}
