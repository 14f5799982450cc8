package com.factory.auth.config;

import com.factory.auth.domain.constants.AuthConstants;
import com.factory.auth.domain.service.TokenCodec;
import com.factory.auth.domain.utils.CryptoUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.charset.StandardCharsets;
import java.time.Clock;

@Configuration
@Slf4j
public class SigningKeyConfig {

    @Bean
    public TokenCodec tokenCodec(AuthProperties properties, Clock clock, CryptoUtils cryptoUtils) {
        return new TokenCodec(signingSecret(properties, cryptoUtils), clock, cryptoUtils);
    }

    private byte[] signingSecret(AuthProperties properties, CryptoUtils cryptoUtils) {
        String configured = properties.getJwtSecret();

        // Try to load from environment first (PRODUCTION)
        if (configured != null && !configured.isBlank()) {
            byte[] secret = configured.getBytes(StandardCharsets.UTF_8);
            if (secret.length < AuthConstants.MIN_SECRET_BYTE_LENGTH) {
                log.error("[SIGNING_KEY_ERROR] Configured secret is too short | bytes={} | required={}",
                        secret.length, AuthConstants.MIN_SECRET_BYTE_LENGTH);
                throw new IllegalStateException("factory.auth.jwt-secret must be at least "
                        + AuthConstants.MIN_SECRET_BYTE_LENGTH + " bytes");
            }
            log.info("[SIGNING_KEY_LOAD] Loading token signing secret from configuration");
            return secret;
        }

        // Fallback to a random key (DEVELOPMENT ONLY)
        log.warn("[SIGNING_KEY_GENERATE] Generating random signing secret - NOT RECOMMENDED FOR PRODUCTION");
        log.warn("[SIGNING_KEY_GENERATE] Issued tokens will not survive a restart. Set JWT_SECRET to keep them valid");
        return cryptoUtils.randomBytes(AuthConstants.MIN_SECRET_BYTE_LENGTH);
    }
}
