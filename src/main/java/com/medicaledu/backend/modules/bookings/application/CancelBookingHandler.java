package com.medicaledu.backend.modules.bookings.application;

import java.time.Clock;
import java.time.OffsetDateTime;

import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.RequestHandler;
import com.medicaledu.backend.modules.availability.domain.AvailabilitySlot;
import com.medicaledu.backend.modules.availability.infrastructure.persistence.AvailabilitySlotRepository;
import com.medicaledu.backend.modules.bookings.domain.Booking;
import com.medicaledu.backend.modules.bookings.infrastructure.persistence.BookingRepository;
import com.medicaledu.backend.modules.bookings.presentation.dto.BookingResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class CancelBookingHandler implements RequestHandler<CancelBookingCommand, Result<BookingResponse>> {

    private static final Logger log = LoggerFactory.getLogger(CancelBookingHandler.class);

    private final BookingRepository bookingRepository;
    private final AvailabilitySlotRepository slotRepository;
    private final Clock clock;

    public CancelBookingHandler(BookingRepository bookingRepository, AvailabilitySlotRepository slotRepository, Clock clock) {
        this.bookingRepository = bookingRepository;
        this.slotRepository = slotRepository;
        this.clock = clock;
    }

    @Override
    public Result<BookingResponse> handle(CancelBookingCommand command) {
        Booking booking = bookingRepository.findByIdForUpdate(command.bookingId()).orElse(null);
        if (booking == null) {
            return Result.notFound("BOOKING_NOT_FOUND");
        }
        if (!booking.isActive()) {
            return Result.conflict("BOOKING_NOT_CANCELLABLE");
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        booking.cancel(command.reason(), command.cancelledBy(), now);
        bookingRepository.save(booking);

        AvailabilitySlot slot = slotRepository.findByIdForUpdate(booking.getSlotId()).orElse(null);
        if (slot != null && slot.getCurrentParticipants() > 0) {
            slot.removeParticipants(1, now);
            slotRepository.save(slot);
        } else {
            log.warn("Booking {} cancelled but slot {} had no participant to release", booking.getId(), booking.getSlotId());
        }
        return Result.success(BookingResponse.from(booking));
    }
}
