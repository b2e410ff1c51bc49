package com.hamco.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class GenerateApiKeyRequest {

    @NotBlank(message = "Name is required.")
    @Size(max = 100, message = "Name must not exceed 100 characters")
    private String name;

    /** Grants the Admin role to callers presenting this key. */
    private boolean admin;

    /** Optional; null means the key never expires. */
    private Instant expiresAt;
}
