package com.factory.auth.domain.service;

import com.factory.auth.domain.constants.AuthConstants;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

import java.nio.charset.StandardCharsets;

@Slf4j
public class BCryptPasswordHasher implements PasswordHasher {

    private final BCryptPasswordEncoder passwordEncoder;
    private final int costFactor;

    public BCryptPasswordHasher(int costFactor) {
        this.costFactor = costFactor;
        this.passwordEncoder = new BCryptPasswordEncoder(costFactor);
    }

    @Override
    public String hash(String rawPassword) {
        if (rawPassword == null || rawPassword.isEmpty()) {
            throw new IllegalArgumentException("Password must not be empty");
        }
        if (!fitsBCryptInput(rawPassword)) {
            throw new IllegalArgumentException(
                    "Password must not exceed " + AuthConstants.MAX_PASSWORD_BYTES + " bytes");
        }
        String hash = passwordEncoder.encode(rawPassword);
        log.debug("[PASSWORD_HASHED] Password hashed with BCrypt | cost={}", costFactor);
        return hash;
    }

    @Override
    public boolean verify(String rawPassword, String passwordHash) {
        if (rawPassword == null || passwordHash == null) {
            return false;
        }
        // Longer input would be truncated and match any password sharing its first 72 bytes
        if (!fitsBCryptInput(rawPassword)) {
            log.debug("[PASSWORD_VERIFY] Password longer than BCrypt input rejected");
            return false;
        }
        // matches() logs and returns false for hashes that are not BCrypt-formatted
        boolean matches = passwordEncoder.matches(rawPassword, passwordHash);
        log.debug("[PASSWORD_VERIFY] Password verification result | matches={}", matches);
        return matches;
    }

    /**
     * BCrypt ignores everything past the first {@value AuthConstants#MAX_PASSWORD_BYTES} UTF-8 bytes.
     */
    public static boolean fitsBCryptInput(String rawPassword) {
        return rawPassword.getBytes(StandardCharsets.UTF_8).length <= AuthConstants.MAX_PASSWORD_BYTES;
    }
}
