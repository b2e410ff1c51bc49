package com.hamco.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.hamco.api.entity.User;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.Set;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UserSummary {
    private String id;
    private String email;
    private String username;
    private Set<String> roles;
    private boolean emailVerified;
    private Instant createdAt;

    public static UserSummary from(User user) {
        return UserSummary.builder()
                .id(user.getId().toString())
                .email(user.getEmail())
                .username(user.getUsername())
                .roles(user.roleNames())
                .emailVerified(user.isEmailVerified())
                .createdAt(user.getCreatedAt())
                .build();
    }
}
