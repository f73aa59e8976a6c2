package com.medicaledu.backend.modules.audit.domain;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

import com.medicaledu.backend.global.common.domain.AuditActionType;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

/**
 * Append-only audit record. Never updated once written.
 */
@Entity
@Table(name = "audit_log")
public class AuditLog {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "entity_name", nullable = false, length = 100, updatable = false)
    private String entityName;

    @Column(name = "entity_id", columnDefinition = "uuid", updatable = false)
    private UUID entityId;

    @Enumerated(EnumType.STRING)
    @Column(name = "action", nullable = false, length = 32, updatable = false)
    private AuditActionType action;

    @Column(name = "user_id", columnDefinition = "uuid", updatable = false)
    private UUID userId;

    @Column(name = "ip_address", length = 45, updatable = false)
    private String ipAddress;

    @Column(name = "user_agent", length = 500, updatable = false)
    private String userAgent;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "old_values", columnDefinition = "jsonb", updatable = false)
    private Map<String, Object> oldValues;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "new_values", columnDefinition = "jsonb", updatable = false)
    private Map<String, Object> newValues;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "metadata", columnDefinition = "jsonb", updatable = false)
    private Map<String, Object> metadata;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    protected AuditLog() {
    }

    public static AuditLog record(
            String entityName,
            UUID entityId,
            AuditActionType action,
            UUID userId,
            String ipAddress,
            String userAgent,
            Map<String, Object> oldValues,
            Map<String, Object> newValues,
            Map<String, Object> metadata,
            OffsetDateTime now
    ) {
        if (entityName == null || entityName.isBlank()) {
            throw new IllegalArgumentException("Entity name is required.");
        }
        if (action == null) {
            throw new IllegalArgumentException("Audit action is required.");
        }
        AuditLog log = new AuditLog();
        log.entityName = entityName;
        log.entityId = entityId;
        log.action = action;
        log.userId = userId;
        log.ipAddress = truncate(ipAddress, 45);
        log.userAgent = truncate(userAgent, 500);
        log.oldValues = oldValues;
        log.newValues = newValues;
        log.metadata = metadata;
        log.createdAt = now;
        return log;
    }

    private static String truncate(String value, int max) {
        if (value == null) {
            return null;
        }
        return value.length() > max ? value.substring(0, max) : value;
    }

    public UUID getId() {
        return id;
    }

    public String getEntityName() {
        return entityName;
    }

    public UUID getEntityId() {
        return entityId;
    }

    public AuditActionType getAction() {
        return action;
    }

    public UUID getUserId() {
        return userId;
    }

    public String getIpAddress() {
        return ipAddress;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public Map<String, Object> getOldValues() {
        return oldValues;
    }

    public Map<String, Object> getNewValues() {
        return newValues;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }
}
