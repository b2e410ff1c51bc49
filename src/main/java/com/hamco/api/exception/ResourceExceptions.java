package com.hamco.api.exception;

import org.springframework.http.HttpStatus;

/**
 * Resource lifecycle errors (not found, state conflicts).
 */
public final class ResourceExceptions {

    private ResourceExceptions() {}

    /** 404 Not Found – target resource does not exist. */
    public static final class NotFound extends ApiException {
        public NotFound(String detail) {
            super(HttpStatus.NOT_FOUND, "not-found", "Resource Not Found", detail);
        }
    }

    /** 409 Conflict – duplicate unique key or illegal transition. */
    public static final class Conflict extends ApiException {
        public Conflict(String detail) {
            super(HttpStatus.CONFLICT, "conflict", "Conflict", detail);
        }
    }
}
