package com.medicaledu.backend.modules.users.application;

import com.medicaledu.backend.global.cache.CacheInvalidation;
import com.medicaledu.backend.global.cache.CachePrefixes;
import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.Command;
import com.medicaledu.backend.modules.users.domain.UserRole;
import com.medicaledu.backend.modules.users.presentation.dto.UserResponse;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

@CacheInvalidation(prefixes = {CachePrefixes.GET_ALL_USERS, CachePrefixes.GET_USERS_BY_ROLE}, reason = "user listings")
public record CreateUserCommand(
        @NotBlank @Size(max = 100) String name,
        @NotBlank @Email @Size(max = 254) String email,
        @NotBlank @Size(min = 8, max = 128) String password,
        @NotNull UserRole role
) implements Command<Result<UserResponse>> {

    @Override
    public String toString() {
        return "CreateUserCommand[email=" + email + ", role=" + role + "]";
    }
}
