package com.hamco.api.serviceImpl;

import com.hamco.api.SecurityConfig.ApiKeyCodec;
import com.hamco.api.entity.ApiKey;
import com.hamco.api.model.ResolvedApiKey;
import com.hamco.api.repository.ApiKeyRepository;
import com.hamco.api.service.ApiKeyResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Prefix lookup followed by a full hash comparison against every active candidate.
 * The prefix only narrows the search; it never authorizes on its own.
 */
@Slf4j
@RequiredArgsConstructor
public class StorageApiKeyResolver implements ApiKeyResolver {

    private final ApiKeyRepository apiKeyRepository;
    private final ApiKeyCodec codec;
    private final Clock clock;

    @Override
    public Optional<ResolvedApiKey> resolve(String secret) {
        if (!codec.isWellFormed(secret)) {
            return Optional.empty();
        }

        List<ApiKey> candidates = apiKeyRepository.findAllByKeyPrefixAndActiveTrue(codec.derivePrefix(secret));
        Instant now = clock.instant();
        for (ApiKey candidate : candidates) {
            if (!candidate.isUsableAt(now)) {
                continue;
            }
            if (codec.verify(secret, candidate.getKeyHash())) {
                return Optional.of(ResolvedApiKey.from(candidate));
            }
        }
        if (candidates.size() > 1) {
            log.debug("No match among {} candidates sharing a prefix", candidates.size());
        }
        return Optional.empty();
    }
}
