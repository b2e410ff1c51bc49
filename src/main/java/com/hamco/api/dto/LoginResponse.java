package com.hamco.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.Set;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LoginResponse {

    private String token;
    @Builder.Default
    private String tokenType = "Bearer";
    private long expiresIn;
    private Instant expiresAt;
    private String userId;
    private String email;
    private Set<String> roles;
}
