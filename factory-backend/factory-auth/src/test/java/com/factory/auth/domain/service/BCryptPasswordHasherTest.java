package com.factory.auth.domain.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("BCryptPasswordHasher")
class BCryptPasswordHasherTest {

    // Minimum BCrypt cost keeps the suite fast
    private final PasswordHasher hasher = new BCryptPasswordHasher(4);

    @Test
    @DisplayName("verifies a password against its own hash")
    void verifiesOwnHash() {
        String hash = hasher.hash("pw123456");

        assertThat(hash).startsWith("$2a$04$");
        assertThat(hasher.verify("pw123456", hash)).isTrue();
    }

    @Test
    @DisplayName("rejects a different password")
    void rejectsDifferentPassword() {
        String hash = hasher.hash("pw123456");

        assertThat(hasher.verify("pw1234567", hash)).isFalse();
    }

    @Test
    @DisplayName("salts every hash")
    void saltsEveryHash() {
        assertThat(hasher.hash("pw123456")).isNotEqualTo(hasher.hash("pw123456"));
    }

    @Test
    @DisplayName("returns false instead of throwing on null or malformed input")
    void neverThrowsOnVerify() {
        assertThat(hasher.verify(null, hasher.hash("pw123456"))).isFalse();
        assertThat(hasher.verify("pw123456", null)).isFalse();
        assertThat(hasher.verify("pw123456", "not-a-bcrypt-hash")).isFalse();
    }

    @Test
    @DisplayName("refuses to hash an empty password")
    void refusesEmptyPassword() {
        assertThatThrownBy(() -> hasher.hash(""))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("refuses to hash a password longer than 72 bytes")
    void refusesOverlongPassword() {
        assertThatThrownBy(() -> hasher.hash("a".repeat(72) + "correct"))
                .isInstanceOf(IllegalArgumentException.class);
        // 36 two-byte characters sit exactly at the limit
        assertThat(hasher.verify("\u00e9".repeat(36), hasher.hash("\u00e9".repeat(36)))).isTrue();
    }

    @Test
    @DisplayName("does not accept a password that only shares the first 72 bytes")
    void rejectsSharedPrefixBeyondLimit() {
        String prefix = "a".repeat(72);
        String hash = hasher.hash(prefix);

        assertThat(hasher.verify(prefix + "WRONG", hash)).isFalse();
        assertThat(hasher.verify(prefix, hash)).isTrue();
    }
}
