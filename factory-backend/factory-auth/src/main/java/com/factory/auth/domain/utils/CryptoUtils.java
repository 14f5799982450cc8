package com.factory.auth.domain.utils;

import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;

@Component
public class CryptoUtils {

    private final SecureRandom secureRandom;

    public CryptoUtils(SecureRandom secureRandom) {
        this.secureRandom = secureRandom;
    }

    /**
     * Constant-time comparison to prevent timing attacks
     */
    public boolean slowEquals(String provided, String stored) {
        if (provided == null || stored == null) {
            return false;
        }
        return MessageDigest.isEqual(
            provided.getBytes(StandardCharsets.UTF_8),
            stored.getBytes(StandardCharsets.UTF_8)
        );
    }

    /**
     * Random key material for an HMAC secret
     */
    public byte[] randomBytes(int length) {
        byte[] bytes = new byte[length];
        secureRandom.nextBytes(bytes);
        return bytes;
    }
}
