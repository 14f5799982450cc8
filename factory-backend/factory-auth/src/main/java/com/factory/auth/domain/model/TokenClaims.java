package com.factory.auth.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class TokenClaims {
    String subject;
    String email;
    String tokenId;
    Instant issuedAt;
    Instant expiresAt;
}
