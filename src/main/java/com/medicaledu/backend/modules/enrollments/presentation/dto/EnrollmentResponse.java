package com.medicaledu.backend.modules.enrollments.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.medicaledu.backend.modules.enrollments.domain.Enrollment;

public record EnrollmentResponse(
        UUID id,
        UUID studentId,
        UUID courseId,
        OffsetDateTime enrolledAt,
        boolean active,
        int progressPercentage,
        OffsetDateTime completedAt,
        OffsetDateTime lastAccessedAt
) {

    public static EnrollmentResponse from(Enrollment enrollment) {
        return new EnrollmentResponse(
                enrollment.getId(),
                enrollment.getStudentId(),
                enrollment.getCourseId(),
                enrollment.getEnrolledAt(),
                enrollment.isActive(),
                enrollment.getProgressPercentage(),
                enrollment.getCompletedAt(),
                enrollment.getLastAccessedAt()
        );
    }
}
