package com.hamco.api.SecurityConfig;

import com.hamco.api.model.AuthPrincipal;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;

/**
 * Spring Security view of an {@link AuthPrincipal}. Roles become {@code ROLE_<name>} authorities.
 */
public class PrincipalAuthentication extends AbstractAuthenticationToken {

    private final AuthPrincipal principal;

    public PrincipalAuthentication(AuthPrincipal principal) {
        super(principal.roles().stream()
                .map(role -> new SimpleGrantedAuthority("ROLE_" + role))
                .toList());
        this.principal = principal;
        setAuthenticated(true);
    }

    @Override
    public Object getCredentials() {
        return null;
    }

    @Override
    public AuthPrincipal getPrincipal() {
        return principal;
    }

    @Override
    public String getName() {
        return principal.subjectId();
    }
}
