package com.hamco.api.serviceImpl;

import com.hamco.api.SecurityConfig.ApiKeyCodec;
import com.hamco.api.dto.ApiKeySummary;
import com.hamco.api.dto.GenerateApiKeyRequest;
import com.hamco.api.dto.GeneratedApiKeyResponse;
import com.hamco.api.entity.ApiKey;
import com.hamco.api.exception.RequestExceptions;
import com.hamco.api.exception.ResourceExceptions;
import com.hamco.api.model.AuthPrincipal;
import com.hamco.api.repository.ApiKeyRepository;
import com.hamco.api.service.ApiKeyResolver;
import com.hamco.api.service.ApiKeyService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class ApiKeyServiceImpl implements ApiKeyService {

    private final ApiKeyRepository apiKeyRepository;
    private final ApiKeyCodec codec;
    private final ApiKeyResolver resolver;
    private final Clock clock;

    @Override
    @Transactional
    public GeneratedApiKeyResponse generate(GenerateApiKeyRequest request, AuthPrincipal creator) {
        if (request.getName() == null || request.getName().isBlank()) {
            throw new RequestExceptions.BadRequest("Name is required.");
        }
        Instant expiresAt = request.getExpiresAt();
        if (expiresAt != null && !expiresAt.isAfter(clock.instant())) {
            throw new RequestExceptions.ValidationFailed("expiresAt must be in the future");
        }

        String plaintext = codec.generate();
        ApiKey key = ApiKey.builder()
                .name(request.getName().trim())
                .keyHash(codec.hash(plaintext))
                .keyPrefix(codec.derivePrefix(plaintext))
                .admin(request.isAdmin())
                .expiresAt(expiresAt)
                .createdByUserId(creator.subjectId())
                .active(true)
                .build();
        ApiKey saved = apiKeyRepository.save(key);

        log.info("API key generated id={} name={} admin={} by={}",
                saved.getId(), saved.getName(), saved.isAdmin(), creator.label());
        return GeneratedApiKeyResponse.builder()
                .key(plaintext)
                .id(saved.getId().toString())
                .name(saved.getName())
                .prefix(saved.getKeyPrefix())
                .admin(saved.isAdmin())
                .createdAt(saved.getCreatedAt())
                .expiresAt(saved.getExpiresAt())
                .build();
    }

    @Override
    @Transactional(readOnly = true)
    public List<ApiKeySummary> list(AuthPrincipal owner) {
        return apiKeyRepository.findAllByCreatedByUserIdOrderByCreatedAtDesc(owner.subjectId())
                .stream()
                .map(ApiKeySummary::from)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public ApiKeySummary get(String id, AuthPrincipal owner) {
        return parseId(id)
                .flatMap(uuid -> apiKeyRepository.findByIdAndCreatedByUserId(uuid, owner.subjectId()))
                .map(ApiKeySummary::from)
                .orElseThrow(() -> notFound(id));
    }

    @Override
    @Transactional
    public void revoke(String id) {
        ApiKey key = parseId(id)
                .flatMap(apiKeyRepository::findById)
                .orElseThrow(() -> notFound(id));

        if (key.isActive()) {
            key.setActive(false);
            apiKeyRepository.save(key);
            log.info("API key revoked id={} name={}", key.getId(), key.getName());
        } else {
            log.debug("API key id={} already revoked", key.getId());
        }
        evictAfterCommit(key.getId().toString());
    }

    /** Cached resolutions must not outlive the committed revocation. */
    private void evictAfterCommit(String keyId) {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    resolver.evict(keyId);
                }
            });
        } else {
            resolver.evict(keyId);
        }
    }

    private static ResourceExceptions.NotFound notFound(String id) {
        return new ResourceExceptions.NotFound("API key with ID '" + id + "' not found.");
    }

    private static Optional<UUID> parseId(String id) {
        if (id == null) return Optional.empty();
        try {
            return Optional.of(UUID.fromString(id.trim()));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
