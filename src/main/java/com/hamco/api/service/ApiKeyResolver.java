package com.hamco.api.service;

import com.hamco.api.model.ResolvedApiKey;

import java.util.Optional;

/**
 * Maps a presented plaintext API key to the active, unexpired key it belongs to.
 * <p>
 * Storage failures propagate as {@link org.springframework.dao.DataAccessException}; an empty result
 * always means "no such usable key".
 */
public interface ApiKeyResolver {

    Optional<ResolvedApiKey> resolve(String secret);

    /** Drop anything remembered about the given key. No-op for non-caching resolvers. */
    default void evict(String apiKeyId) {
    }
}
