package com.hamco.api.repository;

import com.hamco.api.entity.User;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

public interface UserRepository extends JpaRepository<User, UUID> {

    boolean existsByEmail(String email);

    Optional<User> findByEmail(String email);

    /** Outstanding, unexpired verification token. */
    Optional<User> findByEmailVerificationTokenHashAndEmailVerificationTokenExpiresAtAfter(String tokenHash, Instant now);

    /** Outstanding, unexpired reset token. */
    Optional<User> findByPasswordResetTokenHashAndPasswordResetTokenExpiresAtAfter(String tokenHash, Instant now);
}
