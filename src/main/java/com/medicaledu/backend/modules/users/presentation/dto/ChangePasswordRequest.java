package com.medicaledu.backend.modules.users.presentation.dto;

public record ChangePasswordRequest(String currentPassword, String newPassword) {
}
