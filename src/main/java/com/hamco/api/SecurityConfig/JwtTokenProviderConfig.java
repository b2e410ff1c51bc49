package com.hamco.api.SecurityConfig;

import com.hamco.api.config.TokenProperties;
import com.hamco.api.entity.User;
import com.hamco.api.model.AuthPrincipal;
import com.hamco.api.model.IssuedToken;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.io.DecodingException;
import io.jsonwebtoken.io.Decoders;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Date;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Issues and validates HS256 bearer tokens.
 * <p>
 * Configuration is checked at construction: a missing or short secret, or a blank issuer/audience,
 * prevents the application from starting. Issuer and audience are always enforced and there is no
 * clock skew allowance.
 */
@Slf4j
@Component
public class JwtTokenProviderConfig {

    static final String CLAIM_EMAIL = "email";
    static final String CLAIM_ROLES = "roles";
    static final int MIN_SECRET_BYTES = 32;

    private final Clock clock;
    private final String issuer;
    private final String audience;
    private final Duration lifetime;

    /** Cached signing key & parser */
    private final SecretKey signingKey;
    private final JwtParser jwtParser;

    public JwtTokenProviderConfig(TokenProperties properties, Clock clock) {
        this.clock = clock;
        this.issuer = requireText(properties.issuer(), "token.key.issuer");
        this.audience = requireText(properties.audience(), "token.key.audience");
        this.lifetime = properties.lifetime();
        if (lifetime == null || lifetime.isNegative() || lifetime.isZero()) {
            throw new IllegalStateException("token.key.lifetime must be a positive duration.");
        }

        String secret = properties.secret();
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("JWT secret must be provided (base64) via token.key.secret.");
        }
        final byte[] keyBytes;
        try {
            keyBytes = Decoders.BASE64.decode(secret.trim());
        } catch (DecodingException | IllegalArgumentException e) {
            throw new IllegalStateException("JWT secret must be valid Base64.", e);
        }
        // HS256 requires >= 256-bit (32 bytes) key
        if (keyBytes.length < MIN_SECRET_BYTES) {
            throw new IllegalStateException("JWT secret too short for HS256. Provide >= 256-bit Base64 key.");
        }

        this.signingKey = Keys.hmacShaKeyFor(keyBytes);
        this.jwtParser = Jwts.parser()
                .verifyWith(signingKey)
                .requireIssuer(issuer)
                .requireAudience(audience)
                .clock(() -> Date.from(clock.instant()))
                .build();
    }

    /** Sign a token for the given user: subject=id, email, roles, iss, aud, jti, iat, exp. */
    public IssuedToken issue(User user) {
        Instant issuedAt = clock.instant();
        Instant expiresAt = issuedAt.plus(lifetime);
        String tokenId = UUID.randomUUID().toString().replace("-", "");

        String token = Jwts.builder()
                .id(tokenId)
                .subject(user.getId().toString())
                .claim(CLAIM_EMAIL, user.getEmail())
                .claim(CLAIM_ROLES, user.roleNames())
                .issuer(issuer)
                .audience().add(audience).and()
                .issuedAt(Date.from(issuedAt))
                .expiration(Date.from(expiresAt))
                .signWith(signingKey, Jwts.SIG.HS256)
                .compact();
        return new IssuedToken(token, tokenId, issuedAt, expiresAt);
    }

    /**
     * Verify signature, issuer, audience and lifetime. Any failure yields empty; callers never see
     * which check failed.
     */
    public Optional<AuthPrincipal> validate(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        try {
            Claims claims = jwtParser.parseSignedClaims(token).getPayload();
            String subject = claims.getSubject();
            if (subject == null || subject.isBlank()) {
                return Optional.empty();
            }
            // RequiredTypeException is a JwtException: a non-string email claim is rejected here
            return Optional.of(AuthPrincipal.fromToken(subject, claims.get(CLAIM_EMAIL, String.class), rolesOf(claims)));
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Rejected bearer token: {}", e.getMessage());
            return Optional.empty();
        }
    }

    public Duration getLifetime() {
        return lifetime;
    }

    private static Set<String> rolesOf(Claims claims) {
        Object raw = claims.get(CLAIM_ROLES);
        Set<String> roles = new LinkedHashSet<>();
        if (raw instanceof Collection<?> values) {
            for (Object value : values) {
                if (value != null) roles.add(value.toString());
            }
        } else if (raw instanceof String single && !single.isBlank()) {
            roles.add(single);
        }
        return roles;
    }

    private static String requireText(String value, String property) {
        if (value == null || value.isBlank()) {
            throw new IllegalStateException(property + " must be configured.");
        }
        return value;
    }
}
