package com.medicaledu.backend.modules.notifications.application;

import java.time.Clock;
import java.time.OffsetDateTime;

import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.RequestHandler;
import com.medicaledu.backend.modules.notifications.infrastructure.persistence.NotificationRepository;

import org.springframework.stereotype.Service;

@Service
public class MarkAllNotificationsReadHandler implements RequestHandler<MarkAllNotificationsReadCommand, Result<Integer>> {

    private final NotificationRepository notificationRepository;
    private final Clock clock;

    public MarkAllNotificationsReadHandler(NotificationRepository notificationRepository, Clock clock) {
        this.notificationRepository = notificationRepository;
        this.clock = clock;
    }

    @Override
    public Result<Integer> handle(MarkAllNotificationsReadCommand command) {
        return Result.success(notificationRepository.markAllRead(command.userId(), OffsetDateTime.now(clock)));
    }
}
