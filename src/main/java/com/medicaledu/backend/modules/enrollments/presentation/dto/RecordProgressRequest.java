package com.medicaledu.backend.modules.enrollments.presentation.dto;

import java.util.UUID;

public record RecordProgressRequest(UUID materialId, Long secondsSpent, Boolean completed) {
}
