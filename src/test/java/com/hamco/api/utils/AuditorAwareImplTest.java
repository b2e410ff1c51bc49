package com.hamco.api.utils;

import com.hamco.api.SecurityConfig.PrincipalAuthentication;
import com.hamco.api.model.AuthPrincipal;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.authority.AuthorityUtils;
import org.springframework.security.core.context.SecurityContextHolder;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("AuditorAwareImpl Tests")
class AuditorAwareImplTest {

    private final AuditorAwareImpl auditorAware = new AuditorAwareImpl();

    @AfterEach
    void clear() {
        SecurityContextHolder.clearContext();
    }

    @Test
    @DisplayName("No authentication audits as SYSTEM")
    void system() {
        assertThat(auditorAware.getCurrentAuditor()).contains("SYSTEM");
    }

    @Test
    @DisplayName("Anonymous callers audit as SYSTEM")
    void anonymous() {
        SecurityContextHolder.getContext().setAuthentication(new AnonymousAuthenticationToken(
                "key", "anonymousUser", AuthorityUtils.createAuthorityList("ROLE_ANONYMOUS")));

        assertThat(auditorAware.getCurrentAuditor()).contains("SYSTEM");
    }

    @Test
    @DisplayName("Token callers audit by e-mail")
    void user() {
        SecurityContextHolder.getContext().setAuthentication(new PrincipalAuthentication(
                AuthPrincipal.fromToken("u-1", "ada@hamco.dev", Set.of("Admin"))));

        assertThat(auditorAware.getCurrentAuditor()).contains("USER:ada@hamco.dev");
    }

    @Test
    @DisplayName("Key callers audit by key label")
    void key() {
        SecurityContextHolder.getContext().setAuthentication(new PrincipalAuthentication(
                AuthPrincipal.fromApiKey("k-1", "deploy-bot", true)));

        assertThat(auditorAware.getCurrentAuditor()).contains("KEY:apikey:deploy-bot");
    }
}
