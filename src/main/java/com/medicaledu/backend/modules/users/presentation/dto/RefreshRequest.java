package com.medicaledu.backend.modules.users.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record RefreshRequest(
        @NotBlank(message = "refreshToken is required") String refreshToken,
        String deviceId
) {
}
