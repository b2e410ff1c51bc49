package com.hamco.api.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ApiKeyProperties Tests")
class ApiKeyPropertiesTest {

    @Test
    @DisplayName("Accepts TTLs up to five minutes")
    void acceptsBoundary() {
        ApiKeyProperties.Cache cache = new ApiKeyProperties.Cache(true, Duration.ofMinutes(5), 1);

        assertThat(cache.ttl()).isEqualTo(ApiKeyProperties.MAX_CACHE_TTL);
    }

    @Test
    @DisplayName("Rejects a TTL longer than five minutes")
    void rejectsLongTtl() {
        assertThatThrownBy(() -> new ApiKeyProperties.Cache(true, Duration.ofMinutes(5).plusSeconds(1), 100))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("must not exceed");
    }

    @Test
    @DisplayName("Rejects zero or negative TTL and an empty cache")
    void rejectsNonPositive() {
        assertThatThrownBy(() -> new ApiKeyProperties.Cache(true, Duration.ZERO, 100))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> new ApiKeyProperties.Cache(true, Duration.ofSeconds(-1), 100))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> new ApiKeyProperties.Cache(true, Duration.ofSeconds(30), 0))
                .isInstanceOf(IllegalStateException.class);
    }
}
