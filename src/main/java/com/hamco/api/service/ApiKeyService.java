package com.hamco.api.service;

import com.hamco.api.dto.ApiKeySummary;
import com.hamco.api.dto.GenerateApiKeyRequest;
import com.hamco.api.dto.GeneratedApiKeyResponse;
import com.hamco.api.model.AuthPrincipal;

import java.util.List;

/**
 * Admin-side lifecycle of API keys. Validation of presented keys lives in {@link ApiKeyResolver}.
 */
public interface ApiKeyService {

    /** Creates a key owned by {@code creator}. The response is the only place the plaintext appears. */
    GeneratedApiKeyResponse generate(GenerateApiKeyRequest request, AuthPrincipal creator);

    /** Keys created by {@code owner}, newest first. */
    List<ApiKeySummary> list(AuthPrincipal owner);

    ApiKeySummary get(String id, AuthPrincipal owner);

    /**
     * Marks the key inactive. Revoking an already revoked key is a no-op; an unknown id is
     * {@link com.hamco.api.exception.ResourceExceptions.NotFound}.
     */
    void revoke(String id);
}
