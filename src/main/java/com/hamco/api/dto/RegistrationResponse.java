package com.hamco.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RegistrationResponse {
    private String message;
    private String email;
    private boolean requiresEmailVerification;
    /** True when an unverified account already existed and only a fresh link was sent. */
    private boolean resent;
}
