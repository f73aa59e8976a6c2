package com.medicaledu.backend.modules.availability.presentation.dto;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.medicaledu.backend.modules.availability.domain.AvailabilitySlot;

public record AvailabilitySlotResponse(
        UUID id,
        UUID courseId,
        UUID instructorId,
        OffsetDateTime startTimeUtc,
        OffsetDateTime endTimeUtc,
        BigDecimal price,
        String currency,
        int maxParticipants,
        int currentParticipants,
        int remainingCapacity,
        boolean booked,
        boolean active,
        boolean available,
        String notes,
        boolean recurring,
        String recurringPattern,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static AvailabilitySlotResponse from(AvailabilitySlot slot) {
        return new AvailabilitySlotResponse(
                slot.getId(),
                slot.getCourseId(),
                slot.getInstructorId(),
                slot.getStartTimeUtc(),
                slot.getEndTimeUtc(),
                slot.getPrice().getAmount(),
                slot.getPrice().getCurrency().getCode(),
                slot.getMaxParticipants(),
                slot.getCurrentParticipants(),
                slot.getRemainingCapacity(),
                slot.isBooked(),
                slot.isActive(),
                slot.isAvailable(),
                slot.getNotes(),
                slot.isRecurring(),
                slot.getRecurringPattern(),
                slot.getCreatedAt(),
                slot.getUpdatedAt()
        );
    }
}
