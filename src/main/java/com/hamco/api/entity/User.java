package com.hamco.api.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.*;

import java.time.Instant;
import java.util.Set;

@Entity
@Table(
        name = "users",
        indexes = {
                @Index(name = "ix_users_verification_hash", columnList = "email_verification_token_hash"),
                @Index(name = "ix_users_reset_hash", columnList = "password_reset_token_hash")
        }
)
@NoArgsConstructor
@AllArgsConstructor
@Setter
@Getter
@Builder
public class User extends BaseEntity {

    /** Login handle; always stored trimmed and lowercased. */
    @NotBlank(message = "Email is required")
    @Size(max = 255, message = "Email must not exceed 255 characters")
    @Email(message = "Email should be valid")
    @Column(unique = true, nullable = false, length = 255)
    private String email;

    @Size(max = 50)
    @Column(length = 50)
    private String username;

    @Column(name = "password_hash", nullable = false, length = 100)
    @JsonIgnore
    @ToString.Exclude
    private String passwordHash;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 20)
    @Builder.Default
    private UserRole role = UserRole.USER;

    @Builder.Default
    @Column(name = "email_verified", nullable = false)
    private boolean emailVerified = false;

    /** SHA-256 hex of the outstanding verification token. */
    @Column(name = "email_verification_token_hash", length = 64)
    @JsonIgnore
    private String emailVerificationTokenHash;

    @Column(name = "email_verification_token_expires_at")
    private Instant emailVerificationTokenExpiresAt;

    /** SHA-256 hex of the outstanding password reset token. */
    @Column(name = "password_reset_token_hash", length = 64)
    @JsonIgnore
    private String passwordResetTokenHash;

    @Column(name = "password_reset_token_expires_at")
    private Instant passwordResetTokenExpiresAt;

    public boolean isAdmin() {
        return role == UserRole.ADMIN;
    }

    public Set<String> roleNames() {
        return Set.of(role.roleName());
    }
}
