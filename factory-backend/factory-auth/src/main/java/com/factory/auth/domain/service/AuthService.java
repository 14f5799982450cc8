package com.factory.auth.domain.service;

import com.factory.auth.config.AuthProperties;
import com.factory.auth.domain.constants.AuthConstants;
import com.factory.auth.domain.exception.InvalidCredentialsException;
import com.factory.auth.domain.exception.InvalidTokenException;
import com.factory.auth.domain.exception.InvalidTokenException.Reason;
import com.factory.auth.domain.exception.RequestValidationException;
import com.factory.auth.domain.exception.UserAlreadyExistsException;
import com.factory.auth.domain.exception.UserNotFoundException;
import com.factory.auth.domain.model.LoginResult;
import com.factory.auth.domain.model.TokenClaims;
import com.factory.auth.domain.model.TokenPair;
import com.factory.auth.domain.model.User;
import com.factory.auth.domain.model.UserProfile;
import com.factory.auth.domain.utils.CryptoUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Credential lifecycle: registration, password login, access-token validation and refresh.
 * <p>
 * Holds no mutable state of its own. Users live in the {@link UserDirectory}; the one refresh token
 * honored per user lives in the {@link SessionStore}, so a new login supersedes every earlier session.
 * Access tokens are never checked against the store.
 */
@Service
@Slf4j
public class AuthService implements CredentialService {

    private final UserDirectory userDirectory;
    private final SessionStore sessionStore;
    private final PasswordHasher passwordHasher;
    private final TokenCodec tokenCodec;
    private final CryptoUtils cryptoUtils;
    private final Clock clock;
    private final Duration accessTokenTtl;
    private final Duration refreshTokenTtl;
    private final boolean rotateRefreshTokens;

    // Verified against when the email is unknown, so that case costs one BCrypt round like the others
    private final String dummyPasswordHash;

    public AuthService(UserDirectory userDirectory,
                       SessionStore sessionStore,
                       PasswordHasher passwordHasher,
                       TokenCodec tokenCodec,
                       CryptoUtils cryptoUtils,
                       Clock clock,
                       AuthProperties properties) {
        this.userDirectory = userDirectory;
        this.sessionStore = sessionStore;
        this.passwordHasher = passwordHasher;
        this.tokenCodec = tokenCodec;
        this.cryptoUtils = cryptoUtils;
        this.clock = clock;
        this.accessTokenTtl = properties.getAccessTokenTtl();
        this.refreshTokenTtl = properties.getRefreshTokenTtl();
        this.rotateRefreshTokens = properties.isRotateRefreshTokens();
        this.dummyPasswordHash = passwordHasher.hash(UUID.randomUUID().toString());
    }

    @Override
    public UserProfile register(String email, String password, String firstName, String lastName) {
        requireText(email, "email");
        requireText(password, "password");
        requireText(firstName, "first_name");
        requireText(lastName, "last_name");
        if (password.length() < AuthConstants.MIN_PASSWORD_LENGTH) {
            throw new RequestValidationException(
                    "password must be at least " + AuthConstants.MIN_PASSWORD_LENGTH + " characters");
        }
        if (!BCryptPasswordHasher.fitsBCryptInput(password)) {
            throw new RequestValidationException(
                    "password must not exceed " + AuthConstants.MAX_PASSWORD_BYTES + " bytes");
        }

        log.info("[REGISTER_START] Registration attempt | email={}", email);

        if (userDirectory.emailExists(email)) {
            log.warn("[REGISTER_FAILED] Email already registered | email={}", email);
            throw new UserAlreadyExistsException();
        }

        Instant now = clock.instant();
        User user = User.builder()
                .id(UUID.randomUUID().toString())
                .email(email)
                .passwordHash(passwordHasher.hash(password))
                .firstName(firstName)
                .lastName(lastName)
                .active(true)
                .createdAt(now)
                .updatedAt(now)
                .build();

        User created = userDirectory.create(user);
        log.info("[REGISTER_SUCCESS] User registered | userId={} | email={}", created.getId(), email);
        return UserProfile.from(created);
    }

    @Override
    public LoginResult login(String email, String password) {
        requireText(email, "email");
        requireText(password, "password");

        log.info("[LOGIN_START] Login attempt | email={}", email);

        User user = userDirectory.findByEmail(email).orElse(null);
        if (user == null) {
            passwordHasher.verify(password, dummyPasswordHash);
            log.warn("[LOGIN_FAILED] User not found (timing protected) | email={}", email);
            throw new InvalidCredentialsException();
        }
        if (!passwordHasher.verify(password, user.getPasswordHash())) {
            log.warn("[LOGIN_FAILED] Invalid credentials | email={}", email);
            throw new InvalidCredentialsException();
        }
        if (!user.isActive()) {
            log.warn("[LOGIN_FAILED] Account is not active | userId={}", user.getId());
            throw new InvalidCredentialsException();
        }

        String accessToken = tokenCodec.issue(user.getId(), user.getEmail(), accessTokenTtl);
        String refreshToken = tokenCodec.issue(user.getId(), user.getEmail(), refreshTokenTtl);
        sessionStore.put(user.getId(), refreshToken, refreshTokenTtl);

        log.info("[LOGIN_SUCCESS] User authenticated | userId={} | email={}", user.getId(), email);
        return new LoginResult(UserProfile.from(user), accessToken, refreshToken, accessTokenTtl.toSeconds());
    }

    @Override
    public UserProfile validateAccessToken(String accessToken) {
        requireText(accessToken, "token");

        TokenClaims claims = parse(accessToken, "[VALIDATE_FAILED]");
        User user = findActiveUser(claims.getSubject());

        log.debug("[VALIDATE_SUCCESS] Access token accepted | userId={}", user.getId());
        return UserProfile.from(user);
    }

    @Override
    public TokenPair refreshAccessToken(String refreshToken) {
        requireText(refreshToken, "refresh_token");

        TokenClaims claims = parse(refreshToken, "[REFRESH_FAILED]");
        String userId = claims.getSubject();

        String stored = sessionStore.get(userId).orElse(null);
        if (!cryptoUtils.slowEquals(refreshToken, stored)) {
            log.warn("[REFRESH_FAILED] Refresh token is not the current session | userId={} | stored={}",
                    userId, stored != null);
            throw new InvalidTokenException(Reason.SUPERSEDED);
        }

        User user = userDirectory.findById(userId).filter(User::isActive).orElse(null);
        if (user == null) {
            sessionStore.delete(userId);
            log.warn("[REFRESH_FAILED] User missing or inactive, session dropped | userId={}", userId);
            throw new UserNotFoundException();
        }

        String accessToken = tokenCodec.issue(user.getId(), user.getEmail(), accessTokenTtl);
        String nextRefreshToken = refreshToken;
        if (rotateRefreshTokens) {
            nextRefreshToken = tokenCodec.issue(user.getId(), user.getEmail(), refreshTokenTtl);
            if (!sessionStore.replaceIfMatches(userId, refreshToken, nextRefreshToken, refreshTokenTtl)) {
                log.warn("[REFRESH_FAILED] Lost rotation race | userId={}", userId);
                throw new InvalidTokenException(Reason.SUPERSEDED);
            }
        }

        log.info("[REFRESH_SUCCESS] Tokens refreshed | userId={} | rotated={}", userId, rotateRefreshTokens);
        return new TokenPair(accessToken, nextRefreshToken, accessTokenTtl.toSeconds());
    }

    @Override
    public UserProfile getProfile(String userId) {
        requireText(userId, "user_id");
        return UserProfile.from(findActiveUser(userId));
    }

    private TokenClaims parse(String token, String failureTag) {
        try {
            return tokenCodec.parse(token);
        } catch (InvalidTokenException e) {
            log.warn("{} Token rejected | reason={}", failureTag, e.getReason());
            throw e;
        }
    }

    private User findActiveUser(String userId) {
        return userDirectory.findById(userId)
                .filter(User::isActive)
                .orElseThrow(() -> {
                    log.warn("[USER_NOT_FOUND] No active user | userId={}", userId);
                    return new UserNotFoundException();
                });
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new RequestValidationException(field + " is required");
        }
    }
}
