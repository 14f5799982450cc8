package com.factory.auth.domain.service;

import java.time.Duration;
import java.util.Optional;

/**
 * Registry of the single refresh token currently honored for each user.
 * Every operation is atomic for its key. Backend failures surface as
 * {@link com.factory.auth.domain.exception.BackendUnavailableException}.
 */
public interface SessionStore {

    /**
     * Upsert: overwrites whatever token the user had before.
     */
    void put(String userId, String refreshToken, Duration ttl);

    Optional<String> get(String userId);

    void delete(String userId);

    /**
     * Store {@code replacement} only if the current value equals {@code expected}.
     *
     * @return false when the stored value was missing or different
     */
    boolean replaceIfMatches(String userId, String expected, String replacement, Duration ttl);
}
