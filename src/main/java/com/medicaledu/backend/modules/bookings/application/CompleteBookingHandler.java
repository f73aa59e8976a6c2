package com.medicaledu.backend.modules.bookings.application;

import java.time.Clock;
import java.time.OffsetDateTime;

import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.RequestHandler;
import com.medicaledu.backend.modules.bookings.domain.Booking;
import com.medicaledu.backend.modules.bookings.domain.BookingStatus;
import com.medicaledu.backend.modules.bookings.infrastructure.persistence.BookingRepository;
import com.medicaledu.backend.modules.bookings.presentation.dto.BookingResponse;

import org.springframework.stereotype.Service;

@Service
public class CompleteBookingHandler implements RequestHandler<CompleteBookingCommand, Result<BookingResponse>> {

    private final BookingRepository bookingRepository;
    private final Clock clock;

    public CompleteBookingHandler(BookingRepository bookingRepository, Clock clock) {
        this.bookingRepository = bookingRepository;
        this.clock = clock;
    }

    @Override
    public Result<BookingResponse> handle(CompleteBookingCommand command) {
        Booking booking = bookingRepository.findByIdForUpdate(command.bookingId()).orElse(null);
        if (booking == null) {
            return Result.notFound("BOOKING_NOT_FOUND");
        }
        if (booking.getStatus() != BookingStatus.CONFIRMED) {
            return Result.conflict("BOOKING_NOT_CONFIRMED");
        }
        booking.complete(OffsetDateTime.now(clock));
        bookingRepository.save(booking);
        return Result.success(BookingResponse.from(booking));
    }
}
