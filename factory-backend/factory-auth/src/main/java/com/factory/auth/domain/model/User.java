package com.factory.auth.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Identity record as the directory holds it. The password hash never leaves the service;
 * outward views use {@link UserProfile}.
 */
@Value
@Builder(toBuilder = true)
public class User {
    String id;
    String email;
    String passwordHash;
    String firstName;
    String lastName;
    boolean active;
    Instant createdAt;
    Instant updatedAt;
}
