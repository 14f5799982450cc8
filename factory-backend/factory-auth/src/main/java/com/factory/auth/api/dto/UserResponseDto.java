package com.factory.auth.api.dto;

/**
 * {@code data} of register, validate and profile responses.
 */
public class UserResponseDto {

    private final UserDto user;

    public UserResponseDto(UserDto user) {
        this.user = user;
    }

    public UserDto getUser() {
        return user;
    }
}
