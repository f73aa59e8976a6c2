package com.medicaledu.backend.modules.availability.presentation.dto;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

public record CreateAvailabilitySlotRequest(
        UUID courseId,
        UUID instructorId,
        OffsetDateTime startTimeUtc,
        OffsetDateTime endTimeUtc,
        BigDecimal price,
        String currency,
        Integer maxParticipants,
        String notes,
        String recurringPattern
) {
}
