package com.medicaledu.backend.modules.notifications.application;

import java.time.Clock;
import java.time.OffsetDateTime;

import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.RequestHandler;
import com.medicaledu.backend.modules.notifications.domain.Notification;
import com.medicaledu.backend.modules.notifications.infrastructure.persistence.NotificationRepository;
import com.medicaledu.backend.modules.notifications.presentation.dto.NotificationItemResponse;

import org.springframework.stereotype.Service;

@Service
public class MarkNotificationReadHandler implements RequestHandler<MarkNotificationReadCommand, Result<NotificationItemResponse>> {

    private final NotificationRepository notificationRepository;
    private final Clock clock;

    public MarkNotificationReadHandler(NotificationRepository notificationRepository, Clock clock) {
        this.notificationRepository = notificationRepository;
        this.clock = clock;
    }

    @Override
    public Result<NotificationItemResponse> handle(MarkNotificationReadCommand command) {
        Notification notification = notificationRepository
                .findByIdAndUserId(command.notificationId(), command.userId())
                .orElse(null);
        if (notification == null) {
            return Result.notFound("NOTIFICATION_NOT_FOUND");
        }
        if (notification.isRead()) {
            return Result.conflict("NOTIFICATION_ALREADY_READ");
        }
        notification.markRead(OffsetDateTime.now(clock));
        notificationRepository.save(notification);
        return Result.success(NotificationItemResponse.from(notification));
    }
}
