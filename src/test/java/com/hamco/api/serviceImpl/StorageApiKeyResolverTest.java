package com.hamco.api.serviceImpl;

import com.hamco.api.SecurityConfig.ApiKeyCodec;
import com.hamco.api.entity.ApiKey;
import com.hamco.api.model.AuthMethod;
import com.hamco.api.model.AuthPrincipal;
import com.hamco.api.model.ResolvedApiKey;
import com.hamco.api.repository.ApiKeyRepository;
import com.hamco.api.service.PasswordHasher;
import com.hamco.api.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@DisplayName("StorageApiKeyResolver Tests")
class StorageApiKeyResolverTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private ApiKeyRepository repository;
    private PasswordHasher hasher;
    private ApiKeyCodec codec;
    private MutableClock clock;
    private StorageApiKeyResolver resolver;

    @BeforeEach
    void setUp() {
        repository = mock(ApiKeyRepository.class);
        hasher = spy(new BCryptPasswordHasher(new BCryptPasswordEncoder(4)));
        codec = new ApiKeyCodec(hasher);
        clock = new MutableClock(NOW);
        resolver = new StorageApiKeyResolver(repository, codec, clock);
    }

    private ApiKey stored(String secret, boolean admin, Instant expiresAt) {
        ApiKey key = ApiKey.builder()
                .name("deploy-bot")
                .keyHash(codec.hash(secret))
                .keyPrefix(codec.derivePrefix(secret))
                .admin(admin)
                .expiresAt(expiresAt)
                .createdByUserId("creator")
                .active(true)
                .build();
        key.setId(UUID.randomUUID());
        return key;
    }

    @Nested
    @DisplayName("Successful resolution")
    class SuccessTests {

        @Test
        @DisplayName("Non-admin key resolves to a User principal tagged as key")
        void nonAdminKeyResolvesToUser() {
            String secret = codec.generate();
            ApiKey record = stored(secret, false, null);
            when(repository.findAllByKeyPrefixAndActiveTrue(record.getKeyPrefix())).thenReturn(List.of(record));

            Optional<ResolvedApiKey> resolved = resolver.resolve(secret);

            assertThat(resolved).isPresent();
            AuthPrincipal principal = resolved.get().toPrincipal();
            assertThat(principal.roles()).containsExactly("User");
            assertThat(principal.method()).isEqualTo(AuthMethod.API_KEY);
            assertThat(principal.method().tag()).isEqualTo("key");
            assertThat(principal.label()).isEqualTo("apikey:deploy-bot");
            assertThat(principal.apiKeyId()).isEqualTo(record.getId().toString());
        }

        @Test
        @DisplayName("Admin key resolves to an Admin principal")
        void adminKeyResolvesToAdmin() {
            String secret = codec.generate();
            ApiKey record = stored(secret, true, NOW.plus(Duration.ofDays(1)));
            when(repository.findAllByKeyPrefixAndActiveTrue(record.getKeyPrefix())).thenReturn(List.of(record));

            assertThat(resolver.resolve(secret))
                    .map(ResolvedApiKey::toPrincipal)
                    .hasValueSatisfying(p -> assertThat(p.roles()).containsExactly("Admin"));
        }

        @Test
        @DisplayName("Among candidates sharing a prefix, only the matching hash wins")
        void prefixCollision() {
            String secret = codec.generate();
            String prefix = codec.derivePrefix(secret);
            ApiKey decoy = stored(codec.generate(), true, null);
            decoy.setKeyPrefix(prefix);
            ApiKey real = stored(secret, false, null);
            when(repository.findAllByKeyPrefixAndActiveTrue(prefix)).thenReturn(List.of(decoy, real));

            assertThat(resolver.resolve(secret))
                    .map(ResolvedApiKey::id)
                    .contains(real.getId().toString());
        }
    }

    @Nested
    @DisplayName("Rejection")
    class RejectionTests {

        @Test
        @DisplayName("A revoked record is skipped even if storage hands it back")
        void revokedCandidateSkipped() {
            String secret = codec.generate();
            ApiKey record = stored(secret, true, null);
            record.setActive(false);
            when(repository.findAllByKeyPrefixAndActiveTrue(record.getKeyPrefix())).thenReturn(List.of(record));

            assertThat(resolver.resolve(secret)).isEmpty();
            verify(hasher, never()).verify(anyString(), anyString());
        }

        @Test
        @DisplayName("Malformed secrets never reach storage")
        void malformedSkipsStorage() {
            assertThat(resolver.resolve("")).isEmpty();
            assertThat(resolver.resolve("hk_short")).isEmpty();
            assertThat(resolver.resolve("Bearer something-else-entirely-0000000000")).isEmpty();

            verifyNoInteractions(repository);
        }

        @Test
        @DisplayName("A key is expired at exactly its expiry instant")
        void expiryIsInclusive() {
            String secret = codec.generate();
            ApiKey record = stored(secret, false, NOW.plusSeconds(60));
            when(repository.findAllByKeyPrefixAndActiveTrue(record.getKeyPrefix())).thenReturn(List.of(record));

            clock.advance(Duration.ofSeconds(59));
            assertThat(resolver.resolve(secret)).isPresent();

            clock.advance(Duration.ofSeconds(1));
            assertThat(resolver.resolve(secret)).isEmpty();
        }

        @Test
        @DisplayName("Expired candidates are skipped without hashing")
        void expiredSkipsHash() {
            String secret = codec.generate();
            ApiKey record = stored(secret, false, NOW.minusSeconds(1));
            when(repository.findAllByKeyPrefixAndActiveTrue(record.getKeyPrefix())).thenReturn(List.of(record));

            assertThat(resolver.resolve(secret)).isEmpty();
            verify(hasher, never()).verify(anyString(), anyString());
        }

        @Test
        @DisplayName("Unknown prefix resolves to nothing")
        void unknownPrefix() {
            when(repository.findAllByKeyPrefixAndActiveTrue(anyString())).thenReturn(List.of());

            assertThat(resolver.resolve(codec.generate())).isEmpty();
        }

        @Test
        @DisplayName("Storage failures propagate instead of looking like a bad key")
        void storageFailurePropagates() {
            when(repository.findAllByKeyPrefixAndActiveTrue(anyString()))
                    .thenThrow(new QueryTimeoutException("timeout"));

            assertThatThrownBy(() -> resolver.resolve(codec.generate()))
                    .isInstanceOf(QueryTimeoutException.class);
        }
    }
}
