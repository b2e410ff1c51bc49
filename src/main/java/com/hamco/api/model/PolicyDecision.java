package com.hamco.api.model;

/**
 * Outcome of a role check. The two denials map to 401 and 403 respectively.
 */
public enum PolicyDecision {
    ALLOW,
    UNAUTHENTICATED,
    FORBIDDEN;

    public boolean isAllowed() {
        return this == ALLOW;
    }
}
