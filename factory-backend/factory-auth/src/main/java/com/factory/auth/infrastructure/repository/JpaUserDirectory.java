package com.factory.auth.infrastructure.repository;

import com.factory.auth.domain.exception.BackendUnavailableException;
import com.factory.auth.domain.exception.UserAlreadyExistsException;
import com.factory.auth.domain.model.User;
import com.factory.auth.domain.service.UserDirectory;
import com.factory.auth.infrastructure.entity.UserEntity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * {@link UserDirectory} over the {@code users} table. Data-access failures are translated here so
 * nothing above this class sees a Spring exception.
 */
@Repository
@Slf4j
public class JpaUserDirectory implements UserDirectory {

    private final UserRepository userRepository;
    private final Clock clock;

    public JpaUserDirectory(UserRepository userRepository, Clock clock) {
        this.userRepository = userRepository;
        this.clock = clock;
    }

    @Override
    public User create(User user) {
        try {
            UserEntity saved = userRepository.saveAndFlush(toEntity(user));
            log.info("[USER_CREATED] User row inserted | userId={}", saved.getId());
            return toUser(saved);
        } catch (DataIntegrityViolationException e) {
            // concurrent registration won the unique index on email
            log.warn("[USER_CREATE_CONFLICT] Email already taken | email={}", user.getEmail());
            throw new UserAlreadyExistsException(e);
        } catch (DataAccessException e) {
            log.error("[USER_CREATE_ERROR] Failed to insert user | email={}", user.getEmail(), e);
            throw BackendUnavailableException.directory(e);
        }
    }

    @Override
    public Optional<User> findByEmail(String email) {
        return query("findByEmail", () -> userRepository.findByEmail(email).map(JpaUserDirectory::toUser));
    }

    @Override
    public Optional<User> findById(String userId) {
        return query("findById", () -> userRepository.findById(userId).map(JpaUserDirectory::toUser));
    }

    @Override
    public boolean emailExists(String email) {
        boolean exists = query("existsByEmail", () -> userRepository.existsByEmail(email));
        log.debug("[EMAIL_CHECK] Email existence check | email={} | exists={}", email, exists);
        return exists;
    }

    @Override
    @Transactional
    public void deactivate(String userId) {
        int updated = query("deactivate", () -> userRepository.deactivate(userId, clock.instant()));
        log.info("[USER_DEACTIVATED] User deactivated | userId={} | updated={}", userId, updated);
    }

    private <T> T query(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException e) {
            log.error("[USER_DIRECTORY_ERROR] Directory call failed | operation={}", operation, e);
            throw BackendUnavailableException.directory(e);
        }
    }

    private static UserEntity toEntity(User user) {
        return new UserEntity(
                user.getId(),
                user.getEmail(),
                user.getPasswordHash(),
                user.getFirstName(),
                user.getLastName(),
                user.isActive(),
                user.getCreatedAt(),
                user.getUpdatedAt()
        );
    }

    private static User toUser(UserEntity entity) {
        return User.builder()
                .id(entity.getId())
                .email(entity.getEmail())
                .passwordHash(entity.getPasswordHash())
                .firstName(entity.getFirstName())
                .lastName(entity.getLastName())
                .active(entity.isActive())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }
}
