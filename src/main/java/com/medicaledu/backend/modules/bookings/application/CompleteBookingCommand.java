package com.medicaledu.backend.modules.bookings.application;

import java.util.UUID;

import com.medicaledu.backend.global.cache.CacheInvalidation;
import com.medicaledu.backend.global.cache.CachePrefixes;
import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.Command;
import com.medicaledu.backend.modules.bookings.presentation.dto.BookingResponse;

import jakarta.validation.constraints.NotNull;

@CacheInvalidation(prefixes = {CachePrefixes.GET_BOOKINGS, CachePrefixes.GET_BOOKINGS_BY_USER, CachePrefixes.GET_BOOKINGS_BY_INSTRUCTOR})
public record CompleteBookingCommand(@NotNull UUID bookingId) implements Command<Result<BookingResponse>> {
}
