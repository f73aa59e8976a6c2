package com.medicaledu.backend.modules.users.application;

import java.util.UUID;

import com.medicaledu.backend.global.cache.CacheInvalidation;
import com.medicaledu.backend.global.cache.CachePrefixes;
import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.Command;
import com.medicaledu.backend.modules.users.presentation.dto.UserResponse;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

@CacheInvalidation(prefixes = CachePrefixes.GET_USER_BY_ID)
public record ChangePasswordCommand(
        @NotNull UUID userId,
        @NotBlank String currentPassword,
        @NotBlank @Size(min = 8, max = 128) String newPassword
) implements Command<Result<UserResponse>> {

    @Override
    public String toString() {
        return "ChangePasswordCommand[userId=" + userId + "]";
    }
}
