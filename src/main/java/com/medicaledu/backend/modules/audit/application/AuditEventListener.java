package com.medicaledu.backend.modules.audit.application;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.medicaledu.backend.global.common.domain.AuditActionType;
import com.medicaledu.backend.global.common.domain.DomainEvent;
import com.medicaledu.backend.modules.users.domain.UserEvent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Records every published domain event in the audit trail, inside the publishing transaction.
 */
@Component
public class AuditEventListener {

    private static final Logger log = LoggerFactory.getLogger(AuditEventListener.class);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final AuditLogService auditLogService;
    private final ObjectMapper objectMapper;

    public AuditEventListener(AuditLogService auditLogService, ObjectMapper objectMapper) {
        this.auditLogService = auditLogService;
        this.objectMapper = objectMapper;
    }

    @EventListener
    public void onDomainEvent(DomainEvent event) {
        Map<String, Object> newValues = new LinkedHashMap<>(objectMapper.convertValue(event, MAP_TYPE));
        newValues.remove("aggregateId");
        newValues.remove("occurredAt");

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("eventType", event.getClass().getSimpleName());
        metadata.put("occurredAt", event.occurredAt() == null ? null : event.occurredAt().toString());

        auditLogService.record(
                event.aggregateType(),
                event.aggregateId(),
                event.auditAction(),
                actorFallback(event),
                null,
                newValues.isEmpty() ? null : newValues,
                metadata
        );
        log.debug("Audited {} {} on {} {}", event.auditAction(), event.getClass().getSimpleName(),
                event.aggregateType(), event.aggregateId());
    }

    // login and logout happen before an authentication exists; the user is the aggregate itself
    private static UUID actorFallback(DomainEvent event) {
        if (event instanceof UserEvent
                && (event.auditAction() == AuditActionType.LOGIN || event.auditAction() == AuditActionType.LOGOUT)) {
            return event.aggregateId();
        }
        return null;
    }
}
