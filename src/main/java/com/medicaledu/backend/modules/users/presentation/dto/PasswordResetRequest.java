package com.medicaledu.backend.modules.users.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record PasswordResetRequest(@NotBlank(message = "email is required") String email) {
}
