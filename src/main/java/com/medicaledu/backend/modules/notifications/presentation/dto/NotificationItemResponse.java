package com.medicaledu.backend.modules.notifications.presentation.dto;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

import com.medicaledu.backend.modules.notifications.domain.Notification;
import com.medicaledu.backend.modules.notifications.domain.NotificationType;

public record NotificationItemResponse(
        UUID id,
        NotificationType type,
        String title,
        String message,
        boolean read,
        OffsetDateTime createdAt,
        OffsetDateTime readAt,
        UUID relatedEntityId,
        String relatedEntityType,
        Map<String, Object> metadata
) {

    public static NotificationItemResponse from(Notification notification) {
        return new NotificationItemResponse(
                notification.getId(),
                notification.getType(),
                notification.getTitle(),
                notification.getMessage(),
                notification.isRead(),
                notification.getCreatedAt(),
                notification.getReadAt(),
                notification.getRelatedEntityId(),
                notification.getRelatedEntityType(),
                notification.getMetadata()
        );
    }
}
