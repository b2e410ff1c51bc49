package com.hamco.api.SecurityConfig;

import com.hamco.api.model.StepOutcome;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * {@code Authorization: Bearer <jwt>}. A missing or invalid token is skipped, never rejected, so the
 * request can still fall through to the API key step or continue anonymously.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BearerTokenAuthenticationStep implements AuthenticationStep {

    static final String BEARER_PREFIX = "Bearer ";

    private final JwtTokenProviderConfig tokenProvider;

    @Override
    public String name() {
        return "bearer";
    }

    @Override
    public StepOutcome attempt(HttpServletRequest request) {
        final String authHeader = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (!StringUtils.hasText(authHeader) || !authHeader.startsWith(BEARER_PREFIX)) {
            return StepOutcome.skipped();
        }
        final String token = authHeader.substring(BEARER_PREFIX.length()).trim();

        return tokenProvider.validate(token)
                .map(StepOutcome::authenticated)
                .orElseGet(() -> {
                    log.debug("Bearer token present but invalid; continuing without token identity");
                    return StepOutcome.skipped();
                });
    }
}
