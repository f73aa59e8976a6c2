package com.medicaledu.backend.modules.users.application;

import java.util.UUID;

import com.medicaledu.backend.global.cache.CacheInvalidation;
import com.medicaledu.backend.global.cache.CachePrefixes;
import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.Command;
import com.medicaledu.backend.modules.users.presentation.dto.UserResponse;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

@CacheInvalidation(prefixes = {CachePrefixes.GET_USER_BY_ID, CachePrefixes.GET_ALL_USERS, CachePrefixes.GET_USERS_BY_ROLE})
public record UpdateUserProfileCommand(
        @NotNull UUID userId,
        @Size(min = 1, max = 100) String name,
        @Size(max = 64) String timeZone,
        @Size(max = 32) String phoneNumber,
        @Size(max = 2048) String profilePictureUrl
) implements Command<Result<UserResponse>> {
}
