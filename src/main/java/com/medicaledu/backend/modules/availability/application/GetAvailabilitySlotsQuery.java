package com.medicaledu.backend.modules.availability.application;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.medicaledu.backend.global.cache.CachePrefixes;
import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.CacheableQuery;
import com.medicaledu.backend.global.web.PageResponse;
import com.medicaledu.backend.modules.availability.presentation.dto.AvailabilitySlotResponse;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

public record GetAvailabilitySlotsQuery(
        UUID instructorId,
        boolean availableOnly,
        OffsetDateTime startDate,
        OffsetDateTime endDate,
        @Min(0) int page,
        @Min(1) @Max(100) int size
) implements CacheableQuery<Result<PageResponse<AvailabilitySlotResponse>>> {

    @Override
    public String cachePrefix() {
        return CachePrefixes.GET_AVAILABILITY_SLOTS;
    }

    @Override
    public Duration cacheDuration() {
        return Duration.ofMinutes(5);
    }
}
