package com.medicaledu.backend.modules.enrollments.presentation.dto;

import java.util.UUID;

public record CreateEnrollmentRequest(UUID studentId, UUID courseId) {
}
