package com.hamco.api.exception;

import org.springframework.http.HttpStatus;

/**
 * Problems with the incoming client request itself.
 */
public final class RequestExceptions {

    private RequestExceptions() {}

    /** 400 Bad Request – request is syntactically or semantically invalid. */
    public static final class BadRequest extends ApiException {
        public BadRequest(String detail) {
            super(HttpStatus.BAD_REQUEST, "bad-request", "Bad Request", detail);
        }
    }

    /** 422 Unprocessable Entity – parsed fine, but fails a business rule. */
    public static final class ValidationFailed extends ApiException {
        public ValidationFailed(String detail) {
            super(HttpStatus.UNPROCESSABLE_ENTITY, "validation-failed", "Validation Failed", detail);
        }
    }
}
