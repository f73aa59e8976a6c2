package com.medicaledu.backend.modules.notifications.application;

import java.util.Map;
import java.util.UUID;

import com.medicaledu.backend.modules.notifications.domain.Notification;
import com.medicaledu.backend.modules.notifications.domain.NotificationType;
import com.medicaledu.backend.modules.notifications.infrastructure.persistence.NotificationRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Stores notifications for later retrieval. Nothing is delivered from here.
 */
@Service
@Transactional
public class NotificationService {

    private static final Logger log = LoggerFactory.getLogger(NotificationService.class);

    private final NotificationRepository notificationRepository;

    public NotificationService(NotificationRepository notificationRepository) {
        this.notificationRepository = notificationRepository;
    }

    public Notification notify(
            UUID userId,
            NotificationType type,
            String title,
            String message,
            UUID relatedEntityId,
            String relatedEntityType,
            Map<String, Object> metadata
    ) {
        Notification notification = notificationRepository.save(Notification.create(
                userId,
                type,
                title,
                message,
                relatedEntityId,
                relatedEntityType,
                metadata,
                null
        ));
        log.debug("Stored {} notification for user {}", type, userId);
        return notification;
    }
}
