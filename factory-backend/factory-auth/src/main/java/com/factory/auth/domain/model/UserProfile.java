package com.factory.auth.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Public view of a user: everything but the password hash.
 */
@Value
@Builder
public class UserProfile {
    String id;
    String email;
    String firstName;
    String lastName;
    boolean active;
    Instant createdAt;
    Instant updatedAt;

    public static UserProfile from(User user) {
        return UserProfile.builder()
                .id(user.getId())
                .email(user.getEmail())
                .firstName(user.getFirstName())
                .lastName(user.getLastName())
                .active(user.isActive())
                .createdAt(user.getCreatedAt())
                .updatedAt(user.getUpdatedAt())
                .build();
    }
}
