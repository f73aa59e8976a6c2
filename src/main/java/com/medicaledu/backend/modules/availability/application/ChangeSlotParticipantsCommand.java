package com.medicaledu.backend.modules.availability.application;

import java.util.UUID;

import com.medicaledu.backend.global.cache.CacheInvalidation;
import com.medicaledu.backend.global.cache.CachePrefixes;
import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.Command;
import com.medicaledu.backend.modules.availability.presentation.dto.AvailabilitySlotResponse;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

/**
 * Books ({@code release == false}) or releases seats on a slot.
 */
@CacheInvalidation(prefixes = {CachePrefixes.GET_AVAILABILITY_SLOTS, CachePrefixes.GET_AVAILABILITY_SLOTS_BY_INSTRUCTOR})
public record ChangeSlotParticipantsCommand(@NotNull UUID slotId, @Min(1) @Max(1000) int quantity, boolean release)
        implements Command<Result<AvailabilitySlotResponse>> {
}
