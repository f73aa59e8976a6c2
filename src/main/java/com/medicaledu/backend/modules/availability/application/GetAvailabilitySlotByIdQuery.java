package com.medicaledu.backend.modules.availability.application;

import java.time.Duration;
import java.util.UUID;

import com.medicaledu.backend.global.cache.CachePrefixes;
import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.CacheableQuery;
import com.medicaledu.backend.modules.availability.presentation.dto.AvailabilitySlotResponse;

import jakarta.validation.constraints.NotNull;

public record GetAvailabilitySlotByIdQuery(@NotNull UUID slotId) implements CacheableQuery<Result<AvailabilitySlotResponse>> {

    @Override
    public String cachePrefix() {
        return CachePrefixes.GET_AVAILABILITY_SLOTS;
    }

    @Override
    public Duration cacheDuration() {
        return Duration.ofMinutes(5);
    }

    @Override
    public String cacheKey() {
        return CachePrefixes.key(CachePrefixes.GET_AVAILABILITY_SLOTS, slotId);
    }
}
