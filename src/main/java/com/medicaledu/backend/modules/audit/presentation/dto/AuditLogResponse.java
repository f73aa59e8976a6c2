package com.medicaledu.backend.modules.audit.presentation.dto;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

import com.medicaledu.backend.global.common.domain.AuditActionType;
import com.medicaledu.backend.modules.audit.domain.AuditLog;

public record AuditLogResponse(
        UUID id,
        String entityName,
        UUID entityId,
        AuditActionType action,
        UUID userId,
        String ipAddress,
        String userAgent,
        Map<String, Object> oldValues,
        Map<String, Object> newValues,
        Map<String, Object> metadata,
        OffsetDateTime createdAt
) {

    public static AuditLogResponse from(AuditLog log) {
        return new AuditLogResponse(
                log.getId(),
                log.getEntityName(),
                log.getEntityId(),
                log.getAction(),
                log.getUserId(),
                log.getIpAddress(),
                log.getUserAgent(),
                log.getOldValues(),
                log.getNewValues(),
                log.getMetadata(),
                log.getCreatedAt()
        );
    }
}
