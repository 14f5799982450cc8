package com.factory.auth.domain.model;

import lombok.Value;

@Value
public class LoginResult {
    UserProfile user;
    String accessToken;
    String refreshToken;
    long expiresIn;
}
