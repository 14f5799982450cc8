package com.factory.auth.domain.service;

public interface PasswordHasher {

    /**
     * Salted adaptive hash of {@code rawPassword}.
     *
     * @throws IllegalArgumentException if the password is null or empty
     */
    String hash(String rawPassword);

    /**
     * Never throws: a null input or a malformed hash is simply a mismatch.
     */
    boolean verify(String rawPassword, String passwordHash);
}
