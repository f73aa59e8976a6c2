package com.medicaledu.backend.modules.bookings.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.medicaledu.backend.global.common.domain.AuditActionType;

public final class BookingEvents {

    private BookingEvents() {
    }

    public record Created(
            UUID aggregateId,
            OffsetDateTime occurredAt,
            UUID studentId,
            UUID instructorId,
            UUID slotId,
            UUID courseId,
            UUID rescheduledFromBookingId
    ) implements BookingEvent {
        @Override
        public AuditActionType auditAction() {
            return AuditActionType.BOOKING_CREATED;
        }
    }

    public record Confirmed(UUID aggregateId, OffsetDateTime occurredAt, UUID studentId, UUID instructorId)
            implements BookingEvent {
    }

    public record Cancelled(
            UUID aggregateId,
            OffsetDateTime occurredAt,
            UUID studentId,
            UUID instructorId,
            UUID cancelledBy,
            String reason
    ) implements BookingEvent {
    }

    public record Completed(UUID aggregateId, OffsetDateTime occurredAt) implements BookingEvent {
    }

    public record NoShow(UUID aggregateId, OffsetDateTime occurredAt) implements BookingEvent {
    }

    public record Rescheduled(
            UUID aggregateId,
            OffsetDateTime occurredAt,
            UUID studentId,
            UUID instructorId,
            UUID newSlotId
    ) implements BookingEvent {
    }

    public record NotesUpdated(UUID aggregateId, OffsetDateTime occurredAt) implements BookingEvent {
    }
}
