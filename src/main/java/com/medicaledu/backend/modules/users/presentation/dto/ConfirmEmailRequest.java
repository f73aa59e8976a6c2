package com.medicaledu.backend.modules.users.presentation.dto;

public record ConfirmEmailRequest(String token) {
}
