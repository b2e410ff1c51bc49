package com.hamco.api.repository;

import com.hamco.api.entity.ApiKey;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.QueryHints;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ApiKeyRepository extends JpaRepository<ApiKey, UUID> {

    /**
     * Candidates for a presented secret. Runs on the request path, so it carries its own
     * timeout on top of the global query timeout.
     */
    @QueryHints(@QueryHint(name = "jakarta.persistence.query.timeout", value = "2000"))
    List<ApiKey> findAllByKeyPrefixAndActiveTrue(String keyPrefix);

    /** Keys created by one caller, newest first. */
    List<ApiKey> findAllByCreatedByUserIdOrderByCreatedAtDesc(String createdByUserId);

    Optional<ApiKey> findByIdAndCreatedByUserId(UUID id, String createdByUserId);
}
