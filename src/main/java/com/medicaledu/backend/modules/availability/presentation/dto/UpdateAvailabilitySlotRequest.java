package com.medicaledu.backend.modules.availability.presentation.dto;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

/**
 * Partial update. An empty {@code recurringPattern} stops recurrence.
 */
public record UpdateAvailabilitySlotRequest(
        OffsetDateTime startTimeUtc,
        OffsetDateTime endTimeUtc,
        BigDecimal price,
        String currency,
        Integer maxParticipants,
        String notes,
        String recurringPattern
) {
}
