package com.hamco.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/** Returned once, right after generation. The plaintext key is not retrievable afterwards. */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GeneratedApiKeyResponse {
    private String key;
    private String id;
    private String name;
    private String prefix;
    private boolean admin;
    private Instant createdAt;
    private Instant expiresAt;
}
