package com.medicaledu.backend.global.common.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Fact recorded by an aggregate. Published after the aggregate is saved and consumed by the
 * audit trail and notification listeners.
 */
public interface DomainEvent {

    UUID aggregateId();

    OffsetDateTime occurredAt();

    String aggregateType();

    default AuditActionType auditAction() {
        return AuditActionType.UPDATE;
    }
}
