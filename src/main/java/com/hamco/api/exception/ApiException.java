package com.hamco.api.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Base exception carrying HTTP semantics for RFC 7807 responses.
 * Throw these from services/controllers; GlobalExceptionHandler maps them.
 */
@Getter
public abstract class ApiException extends RuntimeException {

    /** Base of every problem type URI this service emits. */
    public static final String PROBLEM_BASE = "https://hamco.dev/problems/";

    private final HttpStatus status;
    private final String type;   // e.g., https://hamco.dev/problems/not-found
    private final String title;  // short summary for ProblemDetail title

    protected ApiException(HttpStatus status, String slug, String title, String detail) {
        super(detail);
        this.status = status;
        this.type = PROBLEM_BASE + slug;
        this.title = title;
    }
}
