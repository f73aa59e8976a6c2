package com.medicaledu.backend.modules.users.presentation.dto;

public record LoginResponse(TokenPairResponse tokens, UserResponse user) {
}
