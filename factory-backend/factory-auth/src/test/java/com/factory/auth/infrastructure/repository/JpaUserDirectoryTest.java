package com.factory.auth.infrastructure.repository;

import com.factory.auth.domain.exception.UserAlreadyExistsException;
import com.factory.auth.domain.model.User;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest(properties = "spring.jpa.hibernate.ddl-auto=create-drop")
@Import({JpaUserDirectory.class, JpaUserDirectoryTest.ClockConfig.class})
@DisplayName("JpaUserDirectory")
class JpaUserDirectoryTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    @TestConfiguration
    static class ClockConfig {
        @Bean
        Clock clock() {
            return Clock.fixed(NOW, ZoneOffset.UTC);
        }
    }

    @Autowired
    private JpaUserDirectory directory;

    private static User user(String email) {
        return User.builder()
                .id(UUID.randomUUID().toString())
                .email(email)
                .passwordHash("$2a$04$hash")
                .firstName("A")
                .lastName("B")
                .active(true)
                .createdAt(NOW.minusSeconds(60))
                .updatedAt(NOW.minusSeconds(60))
                .build();
    }

    @Test
    @DisplayName("creates a user and finds it by email and by id")
    void createsAndFinds() {
        User created = directory.create(user("a@x.com"));

        assertThat(directory.findByEmail("a@x.com")).contains(created);
        assertThat(directory.findById(created.getId())).contains(created);
        assertThat(directory.emailExists("a@x.com")).isTrue();
        assertThat(directory.emailExists("b@x.com")).isFalse();
    }

    @Test
    @DisplayName("matches email case-sensitively as stored")
    void emailIsCaseSensitive() {
        directory.create(user("a@x.com"));

        assertThat(directory.findByEmail("A@X.COM")).isEmpty();
    }

    @Test
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    @DisplayName("translates the unique-email violation into ALREADY_EXISTS")
    void rejectsDuplicateEmail() {
        String email = "dup-" + UUID.randomUUID() + "@x.com";
        directory.create(user(email));

        assertThatThrownBy(() -> directory.create(user(email)))
                .isInstanceOf(UserAlreadyExistsException.class);
    }

    @Test
    @DisplayName("deactivates without deleting the row")
    void softDeletes() {
        User created = directory.create(user("a@x.com"));

        directory.deactivate(created.getId());

        User stored = directory.findById(created.getId()).orElseThrow();
        assertThat(stored.isActive()).isFalse();
        assertThat(stored.getUpdatedAt()).isEqualTo(NOW);
    }
}
