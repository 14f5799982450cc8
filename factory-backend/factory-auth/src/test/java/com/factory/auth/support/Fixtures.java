package com.factory.auth.support;

import com.factory.auth.domain.model.UserProfile;

import java.time.Instant;

public final class Fixtures {

    private Fixtures() {
    }

    public static UserProfile profile() {
        Instant created = Instant.parse("2026-01-01T00:00:00Z");
        return UserProfile.builder()
                .id("user-1")
                .email("a@x.com")
                .firstName("A")
                .lastName("B")
                .active(true)
                .createdAt(created)
                .updatedAt(created)
                .build();
    }
}
