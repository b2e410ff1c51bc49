package com.hamco.api.SecurityConfig;

import com.hamco.api.utils.ErrorResponseWriter;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.lang.NonNull;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Sends 401 Unauthorized when a protected route is reached without an identity.
 * Adds an RFC 6750 WWW-Authenticate hint when the client attempted Bearer auth.
 */
@Slf4j
@Component
public class JwtAuthenticationEntryPoint implements AuthenticationEntryPoint {

    private final ErrorResponseWriter writer;

    public JwtAuthenticationEntryPoint(ErrorResponseWriter writer) {
        this.writer = writer;
    }

    @Override
    public void commence(@NonNull HttpServletRequest request,
                         @NonNull HttpServletResponse response,
                         @NonNull AuthenticationException authException) throws IOException {
        String ah = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (ah != null && ah.startsWith(BearerTokenAuthenticationStep.BEARER_PREFIX)) {
            response.setHeader(HttpHeaders.WWW_AUTHENTICATE, "Bearer error=\"invalid_token\"");
        }
        log.debug("Unauthenticated access to {}", request.getRequestURI());

        writer.write(
                request,
                response,
                HttpStatus.UNAUTHORIZED,
                ErrorResponseWriter.problemType(HttpStatus.UNAUTHORIZED),
                "Unauthorized",
                "Authentication is required to access this resource."
        );
    }
}
