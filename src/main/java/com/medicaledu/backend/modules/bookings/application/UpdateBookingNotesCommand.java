package com.medicaledu.backend.modules.bookings.application;

import java.util.UUID;

import com.medicaledu.backend.global.cache.CacheInvalidation;
import com.medicaledu.backend.global.cache.CachePrefixes;
import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.Command;
import com.medicaledu.backend.modules.bookings.presentation.dto.BookingResponse;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Partial update: {@code null} fields stay as they are. A blank meeting URL clears the meeting.
 */
@CacheInvalidation(prefixes = {CachePrefixes.GET_BOOKINGS, CachePrefixes.GET_BOOKINGS_BY_USER, CachePrefixes.GET_BOOKINGS_BY_INSTRUCTOR})
public record UpdateBookingNotesCommand(
        @NotNull UUID bookingId,
        @Size(max = 1000) String studentNotes,
        @Size(max = 1000) String instructorNotes,
        @Size(max = 2048) String meetingUrl,
        @Size(max = 1000) String meetingNotes
) implements Command<Result<BookingResponse>> {
}
