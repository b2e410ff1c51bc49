package com.hamco.api.controller;

import com.hamco.api.dto.ApiKeySummary;
import com.hamco.api.dto.GenerateApiKeyRequest;
import com.hamco.api.dto.GeneratedApiKeyResponse;
import com.hamco.api.model.AuthPrincipal;
import com.hamco.api.service.ApiKeyService;
import com.hamco.api.utils.ResponseMessage;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

import java.net.URI;
import java.util.List;

/**
 * Admin-only key management; the Admin requirement is enforced on the /api/admin/** route.
 */
@RestController
@RequestMapping("/api/admin/api-keys")
@RequiredArgsConstructor
public class ApiKeysController {

    private final ApiKeyService apiKeyService;

    @PostMapping
    @ResponseMessage("Save this key securely. You won't see it again!")
    public ResponseEntity<GeneratedApiKeyResponse> generate(@Valid @RequestBody GenerateApiKeyRequest request,
                                                            @AuthenticationPrincipal AuthPrincipal principal) {
        GeneratedApiKeyResponse created = apiKeyService.generate(request, principal);
        URI location = ServletUriComponentsBuilder.fromCurrentRequest()
                .path("/{id}")
                .buildAndExpand(created.getId())
                .toUri();
        return ResponseEntity.created(location).body(created);
    }

    @GetMapping
    public ResponseEntity<List<ApiKeySummary>> list(@AuthenticationPrincipal AuthPrincipal principal) {
        return ResponseEntity.ok(apiKeyService.list(principal));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiKeySummary> get(@PathVariable String id,
                                             @AuthenticationPrincipal AuthPrincipal principal) {
        return ResponseEntity.ok(apiKeyService.get(id, principal));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> revoke(@PathVariable String id) {
        apiKeyService.revoke(id);
        return ResponseEntity.noContent().build();
    }
}
