package com.medicaledu.backend.modules.users.application;

import java.util.UUID;

import com.medicaledu.backend.global.cache.CacheInvalidation;
import com.medicaledu.backend.global.cache.CachePrefixes;
import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.Command;
import com.medicaledu.backend.modules.users.presentation.dto.UserResponse;

import jakarta.validation.constraints.NotNull;

@CacheInvalidation(prefixes = {CachePrefixes.GET_USER_BY_ID, CachePrefixes.GET_ALL_USERS, CachePrefixes.GET_USERS_BY_ROLE})
public record DeactivateUserCommand(@NotNull UUID userId) implements Command<Result<UserResponse>> {
}
