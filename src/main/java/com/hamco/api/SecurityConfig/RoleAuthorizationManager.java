package com.hamco.api.SecurityConfig;

import lombok.RequiredArgsConstructor;
import org.springframework.security.authorization.AuthorizationDecision;
import org.springframework.security.authorization.AuthorizationManager;
import org.springframework.security.core.Authentication;
import org.springframework.security.web.access.intercept.RequestAuthorizationContext;

import java.util.function.Supplier;

/**
 * Bridges {@link AuthorizationPolicy} into Spring Security. A denial for an anonymous caller is turned
 * into 401 by the entry point; a denial for an authenticated caller becomes 403.
 */
@RequiredArgsConstructor
public class RoleAuthorizationManager implements AuthorizationManager<RequestAuthorizationContext> {

    private final AuthorizationPolicy policy;
    private final String role;

    @Override
    public AuthorizationDecision check(Supplier<Authentication> authentication,
                                       RequestAuthorizationContext context) {
        return new AuthorizationDecision(policy.requires(authentication.get(), role).isAllowed());
    }
}
