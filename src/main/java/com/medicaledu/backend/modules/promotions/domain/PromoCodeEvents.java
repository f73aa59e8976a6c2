package com.medicaledu.backend.modules.promotions.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.medicaledu.backend.global.common.domain.AuditActionType;

public final class PromoCodeEvents {

    private PromoCodeEvents() {
    }

    public record Created(UUID aggregateId, OffsetDateTime occurredAt, String code) implements PromoCodeEvent {
        @Override
        public AuditActionType auditAction() {
            return AuditActionType.CREATE;
        }
    }

    public record Updated(UUID aggregateId, OffsetDateTime occurredAt) implements PromoCodeEvent {
    }

    public record Redeemed(UUID aggregateId, OffsetDateTime occurredAt, int currentUses) implements PromoCodeEvent {
    }

    public record Deactivated(UUID aggregateId, OffsetDateTime occurredAt) implements PromoCodeEvent {
        @Override
        public AuditActionType auditAction() {
            return AuditActionType.DELETE;
        }
    }
}
