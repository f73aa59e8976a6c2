package com.medicaledu.backend.modules.ratings.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.medicaledu.backend.global.common.domain.AuditActionType;

public final class RatingEvents {

    private RatingEvents() {
    }

    public record CourseRated(UUID aggregateId, OffsetDateTime occurredAt, UUID courseId, UUID studentId, int rating)
            implements RatingEvent {
        @Override
        public String aggregateType() {
            return COURSE_RATING;
        }

        @Override
        public AuditActionType auditAction() {
            return AuditActionType.CREATE;
        }
    }

    public record CourseRatingUpdated(UUID aggregateId, OffsetDateTime occurredAt, int rating) implements RatingEvent {
        @Override
        public String aggregateType() {
            return COURSE_RATING;
        }
    }

    public record InstructorRated(UUID aggregateId, OffsetDateTime occurredAt, UUID instructorId, UUID bookingId, int rating)
            implements RatingEvent {
        @Override
        public String aggregateType() {
            return INSTRUCTOR_RATING;
        }

        @Override
        public AuditActionType auditAction() {
            return AuditActionType.CREATE;
        }
    }
}
