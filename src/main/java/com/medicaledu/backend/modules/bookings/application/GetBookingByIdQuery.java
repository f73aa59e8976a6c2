package com.medicaledu.backend.modules.bookings.application;

import java.time.Duration;
import java.util.UUID;

import com.medicaledu.backend.global.cache.CachePrefixes;
import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.CacheableQuery;
import com.medicaledu.backend.modules.bookings.presentation.dto.BookingResponse;

import jakarta.validation.constraints.NotNull;

public record GetBookingByIdQuery(@NotNull UUID bookingId) implements CacheableQuery<Result<BookingResponse>> {

    @Override
    public String cachePrefix() {
        return CachePrefixes.GET_BOOKINGS;
    }

    @Override
    public Duration cacheDuration() {
        return Duration.ofMinutes(5);
    }

    @Override
    public String cacheKey() {
        return CachePrefixes.key(CachePrefixes.GET_BOOKINGS, bookingId);
    }
}
