package com.medicaledu.backend.modules.notifications.domain;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import com.medicaledu.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

@Entity
@Table(name = "notification")
public class Notification extends AbstractTimestampedEntity {

    public static final int TITLE_MAX_LENGTH = 200;
    public static final int MESSAGE_MAX_LENGTH = 2000;

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "user_id", nullable = false, columnDefinition = "uuid")
    private UUID userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 32)
    private NotificationType type;

    @Column(name = "title", nullable = false, length = TITLE_MAX_LENGTH)
    private String title;

    @Column(name = "message", nullable = false, length = MESSAGE_MAX_LENGTH)
    private String message;

    @Column(name = "is_read", nullable = false)
    private boolean read;

    @Column(name = "read_at")
    private OffsetDateTime readAt;

    @Column(name = "related_entity_id", columnDefinition = "uuid")
    private UUID relatedEntityId;

    @Column(name = "related_entity_type", length = 50)
    private String relatedEntityType;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "metadata", columnDefinition = "jsonb")
    private Map<String, Object> metadata;

    @Column(name = "scheduled_for")
    private OffsetDateTime scheduledFor;

    protected Notification() {
    }

    public static Notification create(
            UUID userId,
            NotificationType type,
            String title,
            String message,
            UUID relatedEntityId,
            String relatedEntityType,
            Map<String, Object> metadata,
            OffsetDateTime scheduledFor
    ) {
        if (userId == null) {
            throw new IllegalArgumentException("Recipient is required.");
        }
        if (type == null) {
            throw new IllegalArgumentException("Notification type is required.");
        }
        if (title == null || title.isBlank() || title.length() > TITLE_MAX_LENGTH) {
            throw new IllegalArgumentException("Title is required and must not exceed " + TITLE_MAX_LENGTH + " characters.");
        }
        if (message == null || message.isBlank() || message.length() > MESSAGE_MAX_LENGTH) {
            throw new IllegalArgumentException("Message is required and must not exceed " + MESSAGE_MAX_LENGTH + " characters.");
        }
        Notification notification = new Notification();
        notification.userId = userId;
        notification.type = type;
        notification.title = title;
        notification.message = message;
        notification.relatedEntityId = relatedEntityId;
        notification.relatedEntityType = relatedEntityType;
        notification.metadata = metadata == null ? new LinkedHashMap<>() : new LinkedHashMap<>(metadata);
        notification.scheduledFor = scheduledFor;
        return notification;
    }

    public void markRead(OffsetDateTime now) {
        if (read) {
            throw new IllegalStateException("Notification is already read.");
        }
        this.read = true;
        this.readAt = now;
    }

    public UUID getId() {
        return id;
    }

    public UUID getUserId() {
        return userId;
    }

    public NotificationType getType() {
        return type;
    }

    public String getTitle() {
        return title;
    }

    public String getMessage() {
        return message;
    }

    public boolean isRead() {
        return read;
    }

    public OffsetDateTime getReadAt() {
        return readAt;
    }

    public UUID getRelatedEntityId() {
        return relatedEntityId;
    }

    public String getRelatedEntityType() {
        return relatedEntityType;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public OffsetDateTime getScheduledFor() {
        return scheduledFor;
    }
}
