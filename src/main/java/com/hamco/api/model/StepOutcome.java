package com.hamco.api.model;

import org.springframework.http.HttpStatus;

import java.util.Objects;

/**
 * Result of one authentication step.
 * AUTHENTICATED ends the chain with a principal, REJECTED ends it with an error response,
 * SKIPPED hands over to the next step.
 */
public record StepOutcome(Kind kind, AuthPrincipal principal, HttpStatus status, String detail) {

    public enum Kind { AUTHENTICATED, SKIPPED, REJECTED }

    private static final StepOutcome SKIPPED = new StepOutcome(Kind.SKIPPED, null, null, null);

    public static StepOutcome authenticated(AuthPrincipal principal) {
        return new StepOutcome(Kind.AUTHENTICATED, Objects.requireNonNull(principal), null, null);
    }

    public static StepOutcome skipped() {
        return SKIPPED;
    }

    public static StepOutcome rejected(HttpStatus status, String detail) {
        return new StepOutcome(Kind.REJECTED, null, Objects.requireNonNull(status), detail);
    }
}
