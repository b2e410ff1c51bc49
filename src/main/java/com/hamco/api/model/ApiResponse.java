package com.hamco.api.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Success envelope written around every 2xx JSON body (errors use RFC 7807 instead).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(
        boolean success,
        String message,
        T data,
        String requestId,
        Instant timestamp
) {
    public static <T> ApiResponse<T> ok(String message, T data, String requestId) {
        return new ApiResponse<>(true, message, data, requestId, Instant.now());
    }
}
