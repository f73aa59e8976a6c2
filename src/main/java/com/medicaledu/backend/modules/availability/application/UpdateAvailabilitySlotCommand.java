package com.medicaledu.backend.modules.availability.application;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.medicaledu.backend.global.cache.CacheInvalidation;
import com.medicaledu.backend.global.cache.CachePrefixes;
import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.Command;
import com.medicaledu.backend.modules.availability.presentation.dto.AvailabilitySlotResponse;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

@CacheInvalidation(prefixes = {CachePrefixes.GET_AVAILABILITY_SLOTS, CachePrefixes.GET_AVAILABILITY_SLOTS_BY_INSTRUCTOR})
public record UpdateAvailabilitySlotCommand(
        @NotNull UUID slotId,
        OffsetDateTime startTimeUtc,
        OffsetDateTime endTimeUtc,
        @DecimalMin("0.00") BigDecimal price,
        @Size(min = 3, max = 3) String currency,
        @Min(1) @Max(1000) Integer maxParticipants,
        @Size(max = 1000) String notes,
        @Size(max = 100) String recurringPattern
) implements Command<Result<AvailabilitySlotResponse>> {
}
