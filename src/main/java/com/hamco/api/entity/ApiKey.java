package com.hamco.api.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * API key record:
 * - Stores only the BCrypt hash of the secret; the plaintext is returned once at generation.
 * - keyPrefix is the first 8 plaintext characters, used to narrow lookups and for display.
 * - Revocation flips active to false and is never undone.
 */
@Entity
@Table(
        name = "api_keys",
        indexes = {
                @Index(name = "ix_api_keys_prefix", columnList = "key_prefix"),
                @Index(name = "ix_api_keys_creator", columnList = "created_by_user_id")
        }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ApiKey extends BaseEntity {

    /** Human-readable label, e.g. "deploy-bot". */
    @Column(nullable = false, length = 100)
    private String name;

    @Column(name = "key_hash", nullable = false, length = 100)
    @ToString.Exclude
    private String keyHash;

    @Column(name = "key_prefix", nullable = false, length = 8)
    private String keyPrefix;

    /** Elevated keys act with the Admin role. */
    @Builder.Default
    @Column(name = "is_admin", nullable = false)
    private boolean admin = false;

    /** Null means the key never expires. */
    @Column(name = "expires_at")
    private Instant expiresAt;

    @Column(name = "created_by_user_id", nullable = false, length = 36)
    private String createdByUserId;

    @Builder.Default
    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    /** Expiry is inclusive: a key is no longer usable at its expiry instant. */
    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    public boolean isUsableAt(Instant now) {
        return active && !isExpiredAt(now);
    }
}
