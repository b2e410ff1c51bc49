package com.hamco.api.model;

import com.hamco.api.entity.ApiKey;

import java.time.Instant;

/**
 * Snapshot of an API key that passed hash verification. Safe to cache: carries no hash material.
 */
public record ResolvedApiKey(String id, String name, boolean admin, Instant expiresAt) {

    public static ResolvedApiKey from(ApiKey key) {
        return new ResolvedApiKey(key.getId().toString(), key.getName(), key.isAdmin(), key.getExpiresAt());
    }

    /** Inclusive: a key is expired at exactly its expiry instant. */
    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    public AuthPrincipal toPrincipal() {
        return AuthPrincipal.fromApiKey(id, name, admin);
    }
}
