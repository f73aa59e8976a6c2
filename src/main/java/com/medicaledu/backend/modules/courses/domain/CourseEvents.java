package com.medicaledu.backend.modules.courses.domain;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.medicaledu.backend.global.common.domain.AuditActionType;

public final class CourseEvents {

    private CourseEvents() {
    }

    public record Created(UUID aggregateId, OffsetDateTime occurredAt, UUID instructorId, String title) implements CourseEvent {
        @Override
        public AuditActionType auditAction() {
            return AuditActionType.CREATE;
        }
    }

    public record Updated(UUID aggregateId, OffsetDateTime occurredAt) implements CourseEvent {
    }

    public record Published(UUID aggregateId, OffsetDateTime occurredAt, UUID instructorId, String title) implements CourseEvent {
    }

    public record Unpublished(UUID aggregateId, OffsetDateTime occurredAt) implements CourseEvent {
    }

    public record Activated(UUID aggregateId, OffsetDateTime occurredAt) implements CourseEvent {
    }

    public record Deactivated(UUID aggregateId, OffsetDateTime occurredAt) implements CourseEvent {
        @Override
        public AuditActionType auditAction() {
            return AuditActionType.DELETE;
        }
    }

    public record MaterialAdded(UUID aggregateId, OffsetDateTime occurredAt, UUID materialId, String materialTitle) implements CourseEvent {
    }

    public record MaterialRemoved(UUID aggregateId, OffsetDateTime occurredAt, UUID materialId) implements CourseEvent {
    }

    public record MaterialsReordered(UUID aggregateId, OffsetDateTime occurredAt, List<UUID> materialIds) implements CourseEvent {
    }
}
