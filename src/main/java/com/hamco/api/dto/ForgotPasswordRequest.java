package com.hamco.api.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ForgotPasswordRequest(
        @NotBlank(message = "email is required")
        @Size(max = 255, message = "email must be <= 255 characters")
        @Email(message = "email is invalid")
        String email
) {
}
