package com.hamco.api.serviceImpl;

import com.github.benmanes.caffeine.cache.Cache;
import com.hamco.api.SecurityConfig.ApiKeyCodec;
import com.hamco.api.model.ResolvedApiKey;
import com.hamco.api.service.ApiKeyResolver;
import com.hamco.api.utils.SecretTokens;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Optional;

/**
 * Caffeine-backed front for another resolver.
 * <p>
 * Entries are keyed by the SHA-256 of the full presented secret, so two secrets sharing a prefix can
 * never share an entry. Hits are re-checked against the key's expiry instant. Misses are remembered
 * too, which keeps repeated bad keys off the slow hash path. Storage exceptions are never cached.
 */
@Slf4j
public class CachingApiKeyResolver implements ApiKeyResolver {

    /** Wrapper so that "no such key" can be stored; Caffeine rejects null values. */
    public record Resolution(ResolvedApiKey key) {
        static final Resolution MISS = new Resolution(null);
    }

    private final ApiKeyResolver delegate;
    private final ApiKeyCodec codec;
    private final Cache<String, Resolution> cache;
    private final Clock clock;

    public CachingApiKeyResolver(ApiKeyResolver delegate, ApiKeyCodec codec,
                                 Cache<String, Resolution> cache, Clock clock) {
        this.delegate = delegate;
        this.codec = codec;
        this.cache = cache;
        this.clock = clock;
    }

    @Override
    public Optional<ResolvedApiKey> resolve(String secret) {
        if (!codec.isWellFormed(secret)) {
            return Optional.empty();
        }

        String cacheKey = SecretTokens.sha256Hex(secret);
        Resolution cached = cache.getIfPresent(cacheKey);
        if (cached != null) {
            if (cached.key() == null) {
                return Optional.empty();
            }
            if (!cached.key().isExpiredAt(clock.instant())) {
                return Optional.of(cached.key());
            }
            cache.invalidate(cacheKey);
            return Optional.empty();
        }

        Optional<ResolvedApiKey> resolved = delegate.resolve(secret);
        cache.put(cacheKey, resolved.map(Resolution::new).orElse(Resolution.MISS));
        return resolved;
    }

    @Override
    public void evict(String apiKeyId) {
        if (apiKeyId == null) return;
        boolean removed = cache.asMap().values()
                .removeIf(r -> r.key() != null && apiKeyId.equals(r.key().id()));
        if (removed) {
            log.debug("Evicted cached resolution for API key {}", apiKeyId);
        }
    }

    long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }
}
