package com.hamco.api.SecurityConfig;

import com.hamco.api.model.StepOutcome;
import com.hamco.api.utils.ErrorResponseWriter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;

/**
 * Runs the authentication steps in order; the first AUTHENTICATED or REJECTED outcome wins.
 * Order: bearer token first, then API key.
 */
@Slf4j
@Component
public class AuthenticationChainFilter extends OncePerRequestFilter {

    private final List<AuthenticationStep> steps;
    private final ErrorResponseWriter writer;

    @Autowired
    public AuthenticationChainFilter(BearerTokenAuthenticationStep bearerStep,
                                     ApiKeyAuthenticationStep apiKeyStep,
                                     ErrorResponseWriter writer) {
        this(List.of(bearerStep, apiKeyStep), writer);
    }

    AuthenticationChainFilter(List<AuthenticationStep> steps, ErrorResponseWriter writer) {
        this.steps = List.copyOf(steps);
        this.writer = writer;
    }

    public List<AuthenticationStep> getSteps() {
        return steps;
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {

        // Someone upstream already authenticated this request
        if (isAuthenticated(SecurityContextHolder.getContext().getAuthentication())) {
            filterChain.doFilter(request, response);
            return;
        }

        for (AuthenticationStep step : steps) {
            StepOutcome outcome = step.attempt(request);
            switch (outcome.kind()) {
                case AUTHENTICATED -> {
                    PrincipalAuthentication authentication = new PrincipalAuthentication(outcome.principal());
                    authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
                    SecurityContext context = SecurityContextHolder.createEmptyContext();
                    context.setAuthentication(authentication);
                    SecurityContextHolder.setContext(context);
                    log.debug("Authenticated {} via {}", outcome.principal().label(), step.name());
                    filterChain.doFilter(request, response);
                    return;
                }
                case REJECTED -> {
                    writer.write(request, response, outcome.status(),
                            ErrorResponseWriter.problemType(outcome.status()),
                            outcome.status().getReasonPhrase(),
                            outcome.detail());
                    return;
                }
                case SKIPPED -> {
                    // next step
                }
            }
        }

        // Nothing matched: continue anonymously, authorization decides
        filterChain.doFilter(request, response);
    }

    private static boolean isAuthenticated(Authentication authentication) {
        return authentication != null
                && authentication.isAuthenticated()
                && !(authentication instanceof AnonymousAuthenticationToken);
    }
}
