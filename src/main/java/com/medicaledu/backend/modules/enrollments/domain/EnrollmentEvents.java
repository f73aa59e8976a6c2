package com.medicaledu.backend.modules.enrollments.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.medicaledu.backend.global.common.domain.AuditActionType;

public final class EnrollmentEvents {

    private EnrollmentEvents() {
    }

    public record Enrolled(UUID aggregateId, OffsetDateTime occurredAt, UUID studentId, UUID courseId) implements EnrollmentEvent {
        @Override
        public AuditActionType auditAction() {
            return AuditActionType.CREATE;
        }
    }

    public record ProgressUpdated(UUID aggregateId, OffsetDateTime occurredAt, int progressPercentage) implements EnrollmentEvent {
    }

    public record Completed(UUID aggregateId, OffsetDateTime occurredAt) implements EnrollmentEvent {
    }

    public record Deactivated(UUID aggregateId, OffsetDateTime occurredAt) implements EnrollmentEvent {
        @Override
        public AuditActionType auditAction() {
            return AuditActionType.DELETE;
        }
    }

    public record Reactivated(UUID aggregateId, OffsetDateTime occurredAt) implements EnrollmentEvent {
    }
}
