package com.factory.auth.support;

import com.factory.auth.domain.service.SessionStore;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Ignores TTLs; tests that need expiry drive it through the token clock instead.
 */
public class InMemorySessionStore implements SessionStore {

    private final Map<String, String> tokens = new ConcurrentHashMap<>();

    @Override
    public void put(String userId, String refreshToken, Duration ttl) {
        tokens.put(userId, refreshToken);
    }

    @Override
    public Optional<String> get(String userId) {
        return Optional.ofNullable(tokens.get(userId));
    }

    @Override
    public void delete(String userId) {
        tokens.remove(userId);
    }

    @Override
    public boolean replaceIfMatches(String userId, String expected, String replacement, Duration ttl) {
        return tokens.replace(userId, expected, replacement);
    }
}
