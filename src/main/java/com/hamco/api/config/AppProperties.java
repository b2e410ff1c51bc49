package com.hamco.api.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

@ConfigurationProperties(prefix = "app")
public record AppProperties(
        @DefaultValue("http://localhost:8080") String baseUrl,
        @DefaultValue("no-reply@hamco.local") String mailFrom,
        @DefaultValue Registration registration,
        @DefaultValue Tokens tokens,
        @DefaultValue Init init
) {

    /** Public sign-up is closed unless explicitly opened. */
    public record Registration(@DefaultValue("false") boolean allowed) {}

    /** Lifetime of e-mail verification and password reset tokens. */
    public record Tokens(@DefaultValue("20m") Duration ttl) {}

    public record Init(@DefaultValue Admin admin) {}

    public record Admin(String email, String password) {}
}
