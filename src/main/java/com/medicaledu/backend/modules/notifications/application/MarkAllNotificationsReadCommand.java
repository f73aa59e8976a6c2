package com.medicaledu.backend.modules.notifications.application;

import java.util.UUID;

import com.medicaledu.backend.global.cache.CacheInvalidation;
import com.medicaledu.backend.global.cache.CachePrefixes;
import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.Command;

import jakarta.validation.constraints.NotNull;

/**
 * Marks every unread notification of the user as read. Yields the number updated.
 */
@CacheInvalidation(prefixes = {CachePrefixes.GET_NOTIFICATIONS, CachePrefixes.GET_NOTIFICATIONS_BY_USER})
public record MarkAllNotificationsReadCommand(@NotNull UUID userId) implements Command<Result<Integer>> {
}
