package com.hamco.api.utils;

import com.hamco.api.model.AuthMethod;
import com.hamco.api.model.AuthPrincipal;
import lombok.NonNull;
import org.springframework.data.domain.AuditorAware;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * createdBy/modifiedBy values: {@code USER:<email>}, {@code KEY:apikey:<name>} or {@code SYSTEM}.
 */
@Component("auditorAware")
public class AuditorAwareImpl implements AuditorAware<String> {

    static final String SYSTEM = "SYSTEM";

    @Override
    @NonNull
    public Optional<String> getCurrentAuditor() {
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();

        // Unauthenticated, anonymous or bootstrap code → SYSTEM
        if (auth == null || !auth.isAuthenticated() || auth instanceof AnonymousAuthenticationToken
                || !(auth.getPrincipal() instanceof AuthPrincipal principal)) {
            return Optional.of(SYSTEM);
        }

        String prefix = principal.method() == AuthMethod.API_KEY ? "KEY" : "USER";
        return Optional.of(prefix + ":" + safe(principal.label(), principal.subjectId()));
    }

    private String safe(String s, String fallback) {
        return (s == null || s.isBlank()) ? fallback : s;
    }
}
