package com.medicaledu.backend.modules.users.application;

import java.time.Duration;
import java.util.UUID;

import com.medicaledu.backend.global.cache.CachePrefixes;
import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.CacheableQuery;
import com.medicaledu.backend.modules.users.presentation.dto.UserResponse;

import jakarta.validation.constraints.NotNull;

public record GetUserByIdQuery(@NotNull UUID userId) implements CacheableQuery<Result<UserResponse>> {

    @Override
    public String cachePrefix() {
        return CachePrefixes.GET_USER_BY_ID;
    }

    @Override
    public Duration cacheDuration() {
        return Duration.ofMinutes(30);
    }

    @Override
    public String cacheKey() {
        return CachePrefixes.key(CachePrefixes.GET_USER_BY_ID, userId);
    }
}
