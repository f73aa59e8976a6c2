package com.medicaledu.backend.modules.availability.application;

import java.util.UUID;

import com.medicaledu.backend.global.cache.CacheInvalidation;
import com.medicaledu.backend.global.cache.CachePrefixes;
import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.Command;
import com.medicaledu.backend.modules.availability.presentation.dto.AvailabilitySlotResponse;

import jakarta.validation.constraints.NotNull;

@CacheInvalidation(prefixes = {CachePrefixes.GET_AVAILABILITY_SLOTS, CachePrefixes.GET_AVAILABILITY_SLOTS_BY_INSTRUCTOR})
public record SetAvailabilitySlotActiveCommand(@NotNull UUID slotId, boolean active)
        implements Command<Result<AvailabilitySlotResponse>> {
}
