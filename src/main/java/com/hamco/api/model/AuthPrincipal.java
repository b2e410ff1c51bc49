package com.hamco.api.model;

import com.hamco.api.entity.UserRole;

import java.util.Objects;
import java.util.Set;

/**
 * Identity attached to a request after successful authentication.
 * Built per request from JWT claims or from an API key record; never persisted.
 *
 * @param subjectId user id for token principals, key id for key principals
 * @param label     e-mail for users, {@code apikey:<name>} for keys
 * @param roles     role names, e.g. {@code Admin}, {@code User}
 * @param method    which mechanism produced this principal
 * @param apiKeyId  key id when {@code method == API_KEY}, otherwise null
 */
public record AuthPrincipal(String subjectId,
                            String label,
                            Set<String> roles,
                            AuthMethod method,
                            String apiKeyId) {

    public AuthPrincipal {
        Objects.requireNonNull(subjectId, "subjectId is required");
        Objects.requireNonNull(method, "method is required");
        roles = roles == null ? Set.of() : Set.copyOf(roles);
    }

    public static AuthPrincipal fromToken(String subjectId, String email, Set<String> roles) {
        return new AuthPrincipal(subjectId, email, roles, AuthMethod.TOKEN, null);
    }

    public static AuthPrincipal fromApiKey(String keyId, String keyName, boolean admin) {
        String role = admin ? UserRole.ADMIN.roleName() : UserRole.USER.roleName();
        return new AuthPrincipal(keyId, "apikey:" + keyName, Set.of(role), AuthMethod.API_KEY, keyId);
    }

    public boolean hasRole(String role) {
        return role != null && roles.contains(role);
    }
}
