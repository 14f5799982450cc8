package com.factory.auth.infrastructure.repository;

import com.factory.auth.infrastructure.entity.UserEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Optional;

public interface UserRepository extends JpaRepository<UserEntity, String> {

    /* ================= HOT PATHS ================= */

    Optional<UserEntity> findByEmail(String email);

    boolean existsByEmail(String email);

    /* ================= ACCOUNT STATE ================= */

    @Modifying(clearAutomatically = true)
    @Query("""
        update UserEntity u
        set u.active = false, u.updatedAt = :updatedAt
        where u.id = :userId
    """)
    int deactivate(@Param("userId") String userId, @Param("updatedAt") Instant updatedAt);
}
