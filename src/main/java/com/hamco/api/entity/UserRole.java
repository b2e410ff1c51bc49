package com.hamco.api.entity;

/**
 * Persisted role of a user account. Token role claims are derived from it at issuance.
 */
public enum UserRole {
    ADMIN("Admin"),
    USER("User");

    private final String roleName;

    UserRole(String roleName) {
        this.roleName = roleName;
    }

    /** Name used in claims and authorization checks. */
    public String roleName() {
        return roleName;
    }
}
