package com.hamco.api.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * JWT signing material and claim expectations, bound once at startup from {@code token.key.*}.
 *
 * @param secret   Base64-encoded HMAC secret (at least 256 bits once decoded)
 * @param issuer   value written to and required in the {@code iss} claim
 * @param audience value written to and required in the {@code aud} claim
 * @param lifetime access token lifetime
 */
@ConfigurationProperties(prefix = "token.key")
public record TokenProperties(
        String secret,
        String issuer,
        String audience,
        @DefaultValue("60m") Duration lifetime
) {
}
