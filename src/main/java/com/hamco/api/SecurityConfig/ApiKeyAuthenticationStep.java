package com.hamco.api.SecurityConfig;

import com.hamco.api.model.ResolvedApiKey;
import com.hamco.api.model.StepOutcome;
import com.hamco.api.service.ApiKeyResolver;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;

import java.util.Optional;

/**
 * {@code X-API-Key: <secret>}. Unlike the bearer step, a presented key that does not resolve is a
 * hard 401, and a storage failure is a 503.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ApiKeyAuthenticationStep implements AuthenticationStep {

    public static final String API_KEY_HEADER = "X-API-Key";
    static final String INVALID_KEY_DETAIL = "Invalid or revoked API key.";
    static final String UNAVAILABLE_DETAIL = "API key validation is temporarily unavailable.";

    private final ApiKeyResolver resolver;

    @Override
    public String name() {
        return "api-key";
    }

    @Override
    public StepOutcome attempt(HttpServletRequest request) {
        final String secret = request.getHeader(API_KEY_HEADER);
        if (secret == null) {
            return StepOutcome.skipped();
        }
        if (secret.isBlank()) {
            return StepOutcome.rejected(HttpStatus.UNAUTHORIZED, INVALID_KEY_DETAIL);
        }

        final Optional<ResolvedApiKey> resolved;
        try {
            resolved = resolver.resolve(secret.trim());
        } catch (DataAccessException | TransactionException ex) {
            log.error("API key lookup failed, refusing request: {}", ex.getMessage());
            return StepOutcome.rejected(HttpStatus.SERVICE_UNAVAILABLE, UNAVAILABLE_DETAIL);
        }

        if (resolved.isEmpty()) {
            log.warn("Invalid or revoked API key attempted: {}", safePrefix(secret.trim()));
            return StepOutcome.rejected(HttpStatus.UNAUTHORIZED, INVALID_KEY_DETAIL);
        }
        log.info("API key authenticated: {}", resolved.get().name());
        return StepOutcome.authenticated(resolved.get().toPrincipal());
    }

    private static String safePrefix(String secret) {
        return secret.length() <= ApiKeyCodec.PREFIX_LENGTH
                ? "<short>"
                : secret.substring(0, ApiKeyCodec.PREFIX_LENGTH);
    }
}
