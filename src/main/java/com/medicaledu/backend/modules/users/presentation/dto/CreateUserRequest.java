package com.medicaledu.backend.modules.users.presentation.dto;

import com.medicaledu.backend.modules.users.domain.UserRole;

public record CreateUserRequest(String name, String email, String password, UserRole role) {
}
