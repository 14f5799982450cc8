package com.factory.auth.domain.model;

import lombok.Value;

/**
 * Result of a refresh. {@code refreshToken} is the rotated token, or the presented one when rotation is off.
 */
@Value
public class TokenPair {
    String accessToken;
    String refreshToken;
    long expiresIn;
}
