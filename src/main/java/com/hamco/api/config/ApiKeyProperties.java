package com.hamco.api.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

@ConfigurationProperties(prefix = "api-key")
public record ApiKeyProperties(@DefaultValue Cache cache) {

    /** Upper bound for the validation cache TTL; a revoked key must stop working quickly. */
    public static final Duration MAX_CACHE_TTL = Duration.ofMinutes(5);

    public record Cache(
            @DefaultValue("true") boolean enabled,
            @DefaultValue("30s") Duration ttl,
            @DefaultValue("10000") long maxSize
    ) {
        public Cache {
            if (ttl == null || ttl.isNegative() || ttl.isZero()) {
                throw new IllegalStateException("api-key.cache.ttl must be a positive duration");
            }
            if (ttl.compareTo(MAX_CACHE_TTL) > 0) {
                throw new IllegalStateException("api-key.cache.ttl must not exceed " + MAX_CACHE_TTL);
            }
            if (maxSize < 1) {
                throw new IllegalStateException("api-key.cache.max-size must be >= 1");
            }
        }
    }
}
