package com.medicaledu.backend.modules.notifications.application;

import java.time.Duration;
import java.util.UUID;

import com.medicaledu.backend.global.cache.CachePrefixes;
import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.CacheableQuery;
import com.medicaledu.backend.modules.notifications.presentation.dto.NotificationListResponse;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

public record GetNotificationsQuery(@NotNull UUID userId, boolean unreadOnly, @Min(0) int page, @Min(1) @Max(100) int size)
        implements CacheableQuery<Result<NotificationListResponse>> {

    @Override
    public String cachePrefix() {
        return CachePrefixes.GET_NOTIFICATIONS_BY_USER;
    }

    @Override
    public Duration cacheDuration() {
        return Duration.ofMinutes(2);
    }
}
