package com.hamco.api.dto;

import com.hamco.api.entity.ApiKey;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/** Listing view of a key. Never carries the secret or its hash. */
@Data
@Builder
public class ApiKeySummary {
    private String id;
    private String name;
    private String prefix;
    private boolean admin;
    private boolean active;
    private Instant createdAt;
    private Instant expiresAt;

    public static ApiKeySummary from(ApiKey key) {
        return ApiKeySummary.builder()
                .id(key.getId().toString())
                .name(key.getName())
                .prefix(key.getKeyPrefix())
                .admin(key.isAdmin())
                .active(key.isActive())
                .createdAt(key.getCreatedAt())
                .expiresAt(key.getExpiresAt())
                .build();
    }
}
