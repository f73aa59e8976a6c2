package com.medicaledu.backend.modules.notifications.application;

import java.util.UUID;

import com.medicaledu.backend.global.cache.CacheInvalidation;
import com.medicaledu.backend.global.cache.CachePrefixes;
import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.Command;
import com.medicaledu.backend.modules.notifications.presentation.dto.NotificationItemResponse;

import jakarta.validation.constraints.NotNull;

@CacheInvalidation(prefixes = {CachePrefixes.GET_NOTIFICATIONS, CachePrefixes.GET_NOTIFICATIONS_BY_USER})
public record MarkNotificationReadCommand(@NotNull UUID userId, @NotNull UUID notificationId)
        implements Command<Result<NotificationItemResponse>> {
}
