package com.factory.auth.infrastructure.session;

import com.factory.auth.domain.exception.BackendUnavailableException;
import com.factory.auth.domain.service.SessionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static com.factory.auth.domain.constants.AuthConstants.REDIS_REFRESH_TOKEN_PREFIX;

@Component
@Slf4j
public class RedisSessionStore implements SessionStore {

    private final StringRedisTemplate redisTemplate;
    private final RedisScript<Long> refreshRotateScript;

    public RedisSessionStore(StringRedisTemplate redisTemplate, RedisScript<Long> refreshRotateScript) {
        this.redisTemplate = redisTemplate;
        this.refreshRotateScript = refreshRotateScript;
    }

    @Override
    public void put(String userId, String refreshToken, Duration ttl) {
        try {
            redisTemplate.opsForValue().set(key(userId), refreshToken, ttl);
            log.debug("[SESSION_STORED] Refresh token stored | userId={} | ttl={}s", userId, ttl.toSeconds());
        } catch (DataAccessException e) {
            throw unavailable("put", userId, e);
        }
    }

    @Override
    public Optional<String> get(String userId) {
        try {
            return Optional.ofNullable(redisTemplate.opsForValue().get(key(userId)));
        } catch (DataAccessException e) {
            throw unavailable("get", userId, e);
        }
    }

    @Override
    public void delete(String userId) {
        try {
            redisTemplate.delete(key(userId));
            log.debug("[SESSION_DELETED] Refresh token removed | userId={}", userId);
        } catch (DataAccessException e) {
            throw unavailable("delete", userId, e);
        }
    }

    @Override
    public boolean replaceIfMatches(String userId, String expected, String replacement, Duration ttl) {
        try {
            Long result = redisTemplate.execute(
                    refreshRotateScript,
                    List.of(key(userId)),
                    expected, replacement, String.valueOf(ttl.toMillis()));
            boolean replaced = result != null && result == 1L;
            log.debug("[SESSION_ROTATE] Compare-and-set executed | userId={} | replaced={}", userId, replaced);
            return replaced;
        } catch (DataAccessException e) {
            throw unavailable("replaceIfMatches", userId, e);
        }
    }

    private static String key(String userId) {
        return REDIS_REFRESH_TOKEN_PREFIX + userId;
    }

    private static BackendUnavailableException unavailable(String operation, String userId, DataAccessException e) {
        log.error("[SESSION_STORE_ERROR] Session store call failed | operation={} | userId={}", operation, userId, e);
        return BackendUnavailableException.sessionStore(e);
    }
}
