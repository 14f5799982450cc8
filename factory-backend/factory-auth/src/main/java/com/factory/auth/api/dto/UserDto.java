package com.factory.auth.api.dto;

import com.factory.auth.domain.model.UserProfile;

import java.time.Instant;

public class UserDto {

    private final String id;
    private final String email;
    private final String firstName;
    private final String lastName;
    private final boolean active;
    private final Instant createdAt;
    private final Instant updatedAt;

    public UserDto(String id, String email, String firstName, String lastName,
                   boolean active, Instant createdAt, Instant updatedAt) {
        this.id = id;
        this.email = email;
        this.firstName = firstName;
        this.lastName = lastName;
        this.active = active;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    public static UserDto from(UserProfile profile) {
        return new UserDto(
                profile.getId(),
                profile.getEmail(),
                profile.getFirstName(),
                profile.getLastName(),
                profile.isActive(),
                profile.getCreatedAt(),
                profile.getUpdatedAt()
        );
    }

    // Getters
    public String getId() {
        return id;
    }

    public String getEmail() {
        return email;
    }

    public String getFirstName() {
        return firstName;
    }

    public String getLastName() {
        return lastName;
    }

    public boolean isActive() {
        return active;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
