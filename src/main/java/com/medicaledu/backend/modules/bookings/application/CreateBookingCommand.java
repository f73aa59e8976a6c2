package com.medicaledu.backend.modules.bookings.application;

import java.util.UUID;

import com.medicaledu.backend.global.cache.CacheInvalidation;
import com.medicaledu.backend.global.cache.CachePrefixes;
import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.Command;
import com.medicaledu.backend.modules.bookings.presentation.dto.BookingResponse;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

@CacheInvalidation(prefixes = {CachePrefixes.GET_BOOKINGS, CachePrefixes.GET_BOOKINGS_BY_USER, CachePrefixes.GET_BOOKINGS_BY_INSTRUCTOR})
@CacheInvalidation(prefixes = {CachePrefixes.GET_AVAILABILITY_SLOTS, CachePrefixes.GET_AVAILABILITY_SLOTS_BY_INSTRUCTOR})
@CacheInvalidation(prefixes = {CachePrefixes.GET_NOTIFICATIONS_BY_USER, CachePrefixes.GET_PROMO_CODES})
public record CreateBookingCommand(
        @NotNull UUID studentId,
        @NotNull UUID slotId,
        @Size(max = 20) String promoCode,
        @Size(max = 1000) String notes
) implements Command<Result<BookingResponse>> {
}
