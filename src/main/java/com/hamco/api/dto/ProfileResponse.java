package com.hamco.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.util.Set;

/**
 * Who the caller is, however they authenticated. {@code user} is only present for token callers.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProfileResponse {
    private String subjectId;
    private String label;
    private Set<String> roles;
    private String method;
    private String apiKeyId;
    private UserSummary user;
}
