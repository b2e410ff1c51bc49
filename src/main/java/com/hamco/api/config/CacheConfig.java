package com.hamco.api.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.hamco.api.SecurityConfig.ApiKeyCodec;
import com.hamco.api.repository.ApiKeyRepository;
import com.hamco.api.service.ApiKeyResolver;
import com.hamco.api.serviceImpl.CachingApiKeyResolver;
import com.hamco.api.serviceImpl.StorageApiKeyResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.TimeUnit;

@Slf4j
@Configuration
public class CacheConfig {

    /**
     * Caffeine cache for API key resolutions:
     * - Capacity and TTL from api-key.cache.*
     * - Time read from the application Clock so expiry follows the same notion of "now" as the rest of auth
     * - Maintenance on the calling thread
     */
    @Bean
    public Cache<String, CachingApiKeyResolver.Resolution> apiKeyResolutionCache(ApiKeyProperties properties,
                                                                                 Clock clock) {
        ApiKeyProperties.Cache settings = properties.cache();
        Ticker ticker = () -> TimeUnit.MILLISECONDS.toNanos(clock.millis());
        return Caffeine.newBuilder()
                .maximumSize(settings.maxSize())
                .expireAfterWrite(settings.ttl())
                .ticker(ticker)
                .executor(Runnable::run)
                .recordStats()
                .build();
    }

    @Bean
    public ApiKeyResolver apiKeyResolver(ApiKeyRepository apiKeyRepository,
                                         ApiKeyCodec codec,
                                         ApiKeyProperties properties,
                                         Cache<String, CachingApiKeyResolver.Resolution> apiKeyResolutionCache,
                                         Clock clock) {
        ApiKeyResolver storage = new StorageApiKeyResolver(apiKeyRepository, codec, clock);
        if (!properties.cache().enabled()) {
            log.info("API key resolution cache disabled; every request hits storage");
            return storage;
        }
        log.info("API key resolution cache enabled (ttl={}, maxSize={})",
                properties.cache().ttl(), properties.cache().maxSize());
        return new CachingApiKeyResolver(storage, codec, apiKeyResolutionCache, clock);
    }
}
