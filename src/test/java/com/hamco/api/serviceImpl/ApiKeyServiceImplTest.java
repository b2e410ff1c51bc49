package com.hamco.api.serviceImpl;

import com.hamco.api.SecurityConfig.ApiKeyCodec;
import com.hamco.api.dto.ApiKeySummary;
import com.hamco.api.dto.GenerateApiKeyRequest;
import com.hamco.api.dto.GeneratedApiKeyResponse;
import com.hamco.api.entity.ApiKey;
import com.hamco.api.exception.RequestExceptions;
import com.hamco.api.exception.ResourceExceptions;
import com.hamco.api.model.AuthPrincipal;
import com.hamco.api.model.ResolvedApiKey;
import com.hamco.api.repository.ApiKeyRepository;
import com.hamco.api.service.ApiKeyResolver;
import com.hamco.api.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("ApiKeyServiceImpl Tests")
class ApiKeyServiceImplTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private final List<ApiKey> store = new ArrayList<>();
    private ApiKeyRepository repository;
    private ApiKeyCodec codec;
    private MutableClock clock;
    private ApiKeyResolver resolver;
    private ApiKeyServiceImpl service;

    private final AuthPrincipal admin = AuthPrincipal.fromToken("admin-1", "admin@hamco.dev", Set.of("Admin"));
    private final AuthPrincipal otherAdmin = AuthPrincipal.fromToken("admin-2", "root@hamco.dev", Set.of("Admin"));

    @BeforeEach
    void setUp() {
        repository = mock(ApiKeyRepository.class);
        codec = new ApiKeyCodec(new BCryptPasswordHasher(new BCryptPasswordEncoder(4)));
        clock = new MutableClock(NOW);
        resolver = spy(new StorageApiKeyResolver(repository, codec, clock));
        service = new ApiKeyServiceImpl(repository, codec, resolver, clock);

        // In-memory stand-in for the table
        when(repository.save(any(ApiKey.class))).thenAnswer(inv -> {
            ApiKey key = inv.getArgument(0);
            if (key.getId() == null) {
                key.setId(UUID.randomUUID());
                key.setCreatedAt(clock.instant());
                store.add(key);
            }
            clock.advance(Duration.ofSeconds(1));
            return key;
        });
        when(repository.findById(any(UUID.class))).thenAnswer(inv ->
                store.stream().filter(k -> k.getId().equals(inv.getArgument(0))).findFirst());
        when(repository.findAllByKeyPrefixAndActiveTrue(anyString())).thenAnswer(inv ->
                store.stream().filter(k -> k.isActive() && k.getKeyPrefix().equals(inv.getArgument(0))).toList());
        when(repository.findAllByCreatedByUserIdOrderByCreatedAtDesc(anyString())).thenAnswer(inv ->
                store.stream()
                        .filter(k -> k.getCreatedByUserId().equals(inv.getArgument(0)))
                        .sorted(Comparator.comparing(ApiKey::getCreatedAt).reversed())
                        .toList());
        when(repository.findByIdAndCreatedByUserId(any(UUID.class), anyString())).thenAnswer(inv ->
                store.stream()
                        .filter(k -> k.getId().equals(inv.getArgument(0))
                                && k.getCreatedByUserId().equals(inv.getArgument(1)))
                        .findFirst());
    }

    private GeneratedApiKeyResponse generate(String name, boolean isAdmin) {
        return service.generate(new GenerateApiKeyRequest(name, isAdmin, null), admin);
    }

    @Nested
    @DisplayName("Generation")
    class GenerationTests {

        @Test
        @DisplayName("Returns the plaintext once and stores only its hash and prefix")
        void storesHashOnly() {
            GeneratedApiKeyResponse created = generate("deploy-bot", false);

            ApiKey stored = store.get(0);
            assertThat(created.getKey()).startsWith("hk_");
            assertThat(stored.getKeyHash()).isNotEqualTo(created.getKey()).doesNotContain(created.getKey());
            assertThat(stored.getKeyPrefix()).isEqualTo(created.getKey().substring(0, 8)).isEqualTo(created.getPrefix());
            assertThat(stored.getCreatedByUserId()).isEqualTo("admin-1");
            assertThat(stored.isActive()).isTrue();
            assertThat(stored.getExpiresAt()).isNull();
        }

        @Test
        @DisplayName("Non-admin key resolves to a User principal tagged key")
        void nonAdminKeyPrincipal() {
            GeneratedApiKeyResponse created = generate("reader", false);

            Optional<ResolvedApiKey> resolved = resolver.resolve(created.getKey());

            assertThat(resolved).isPresent();
            assertThat(resolved.get().toPrincipal().roles()).containsExactly("User");
            assertThat(resolved.get().toPrincipal().method().tag()).isEqualTo("key");
        }

        @Test
        @DisplayName("Rejects an expiry that is not in the future")
        void pastExpiry() {
            assertThatThrownBy(() -> service.generate(new GenerateApiKeyRequest("x", false, NOW), admin))
                    .isInstanceOf(RequestExceptions.ValidationFailed.class);
        }

        @Test
        @DisplayName("Rejects a blank name")
        void blankName() {
            assertThatThrownBy(() -> generate("  ", false))
                    .isInstanceOf(RequestExceptions.BadRequest.class);
        }
    }

    @Nested
    @DisplayName("Revocation")
    class RevocationTests {

        @Test
        @DisplayName("A revoked elevated key can no longer be resolved")
        void revokedElevatedKey() {
            GeneratedApiKeyResponse created = generate("ops", true);
            assertThat(resolver.resolve(created.getKey()))
                    .map(r -> r.toPrincipal().roles())
                    .contains(Set.of("Admin"));

            service.revoke(created.getId());

            assertThat(resolver.resolve(created.getKey())).isEmpty();
        }

        @Test
        @DisplayName("Revoking twice raises nothing and the key stays inactive")
        void idempotent() {
            GeneratedApiKeyResponse created = generate("ops", true);

            service.revoke(created.getId());
            service.revoke(created.getId());

            assertThat(store.get(0).isActive()).isFalse();
            verify(resolver, times(2)).evict(created.getId());
        }

        @Test
        @DisplayName("Unknown or malformed ids are not found")
        void unknownId() {
            assertThatThrownBy(() -> service.revoke(UUID.randomUUID().toString()))
                    .isInstanceOf(ResourceExceptions.NotFound.class)
                    .hasMessageContaining("not found");
            assertThatThrownBy(() -> service.revoke("not-a-uuid"))
                    .isInstanceOf(ResourceExceptions.NotFound.class);
            verify(resolver, never()).evict(anyString());
        }
    }

    @Nested
    @DisplayName("Listing")
    class ListingTests {

        @Test
        @DisplayName("Lists only the caller's keys, newest first, without secrets")
        void listOwnNewestFirst() {
            generate("first", false);
            generate("second", true);
            service.generate(new GenerateApiKeyRequest("foreign", false, null), otherAdmin);

            List<ApiKeySummary> keys = service.list(admin);

            assertThat(keys).extracting(ApiKeySummary::getName).containsExactly("second", "first");
        }

        @Test
        @DisplayName("Get is scoped to the caller")
        void getScoped() {
            GeneratedApiKeyResponse mine = generate("mine", false);

            assertThat(service.get(mine.getId(), admin).getName()).isEqualTo("mine");
            assertThatThrownBy(() -> service.get(mine.getId(), otherAdmin))
                    .isInstanceOf(ResourceExceptions.NotFound.class);
        }
    }
}
