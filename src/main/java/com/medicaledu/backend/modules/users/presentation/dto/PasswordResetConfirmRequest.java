package com.medicaledu.backend.modules.users.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record PasswordResetConfirmRequest(
        @NotBlank(message = "email is required") String email,
        @NotBlank(message = "token is required") String token,
        @NotBlank(message = "newPassword is required")
        @Size(min = 8, max = 128, message = "newPassword must be 8-128 characters") String newPassword
) {
}
