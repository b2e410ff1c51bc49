package com.hamco.api.SecurityConfig;

import com.hamco.api.model.AuthPrincipal;
import com.hamco.api.model.PolicyDecision;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.stereotype.Component;

/**
 * Role requirements, independent of how the caller authenticated. A key principal created with the
 * admin flag satisfies the same requirement as a token principal carrying the Admin role.
 */
@Component
public class AuthorizationPolicy {

    public PolicyDecision requires(AuthPrincipal principal, String role) {
        if (principal == null) {
            return PolicyDecision.UNAUTHENTICATED;
        }
        return principal.hasRole(role) ? PolicyDecision.ALLOW : PolicyDecision.FORBIDDEN;
    }

    public PolicyDecision requires(Authentication authentication, String role) {
        return requires(principalOf(authentication), role);
    }

    /** Route-level adapter for {@code authorizeHttpRequests(...).access(...)}. */
    public RoleAuthorizationManager requiring(String role) {
        return new RoleAuthorizationManager(this, role);
    }

    static AuthPrincipal principalOf(Authentication authentication) {
        if (authentication == null
                || !authentication.isAuthenticated()
                || authentication instanceof AnonymousAuthenticationToken) {
            return null;
        }
        return authentication.getPrincipal() instanceof AuthPrincipal p ? p : null;
    }
}
