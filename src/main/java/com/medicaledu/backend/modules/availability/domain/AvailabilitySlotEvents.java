package com.medicaledu.backend.modules.availability.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.medicaledu.backend.global.common.domain.AuditActionType;

public final class AvailabilitySlotEvents {

    private AvailabilitySlotEvents() {
    }

    public record Created(UUID aggregateId, OffsetDateTime occurredAt, UUID courseId, UUID instructorId) implements AvailabilitySlotEvent {
        @Override
        public AuditActionType auditAction() {
            return AuditActionType.CREATE;
        }
    }

    public record Updated(UUID aggregateId, OffsetDateTime occurredAt) implements AvailabilitySlotEvent {
    }

    public record ParticipantsChanged(UUID aggregateId, OffsetDateTime occurredAt, int currentParticipants, int maxParticipants)
            implements AvailabilitySlotEvent {
    }

    public record Activated(UUID aggregateId, OffsetDateTime occurredAt) implements AvailabilitySlotEvent {
    }

    public record Deactivated(UUID aggregateId, OffsetDateTime occurredAt) implements AvailabilitySlotEvent {
        @Override
        public AuditActionType auditAction() {
            return AuditActionType.DELETE;
        }
    }
}
