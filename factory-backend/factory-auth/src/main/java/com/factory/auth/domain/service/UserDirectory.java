package com.factory.auth.domain.service;

import com.factory.auth.domain.model.User;

import java.util.Optional;

/**
 * Persistent user records. Lookups return inactive users as well.
 */
public interface UserDirectory {

    /**
     * @throws com.factory.auth.domain.exception.UserAlreadyExistsException if the email is taken
     */
    User create(User user);

    Optional<User> findByEmail(String email);

    Optional<User> findById(String userId);

    boolean emailExists(String email);

    /**
     * Soft delete: the record stays but is no longer active.
     */
    void deactivate(String userId);
}
