package com.hamco.api.dto;

import com.hamco.api.Validators.PasswordMatch;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@PasswordMatch(passwordField = "newPassword", passwordConfirmationField = "passwordConfirmation")
public class ResetPasswordRequest {

    @NotBlank(message = "token is required")
    @Size(max = 128, message = "token must be <= 128 characters")
    private String token;

    @NotBlank(message = "newPassword is required")
    @Size(min = 8, max = 72, message = "newPassword must be between 8 and 72 characters")
    private String newPassword;

    @NotBlank(message = "passwordConfirmation is required")
    private String passwordConfirmation;
}
