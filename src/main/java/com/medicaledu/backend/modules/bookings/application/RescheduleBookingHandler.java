package com.medicaledu.backend.modules.bookings.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.RequestHandler;
import com.medicaledu.backend.modules.availability.domain.AvailabilitySlot;
import com.medicaledu.backend.modules.availability.infrastructure.persistence.AvailabilitySlotRepository;
import com.medicaledu.backend.modules.bookings.domain.Booking;
import com.medicaledu.backend.modules.bookings.domain.BookingStatus;
import com.medicaledu.backend.modules.bookings.infrastructure.persistence.BookingRepository;
import com.medicaledu.backend.modules.bookings.presentation.dto.BookingResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class RescheduleBookingHandler implements RequestHandler<RescheduleBookingCommand, Result<BookingResponse>> {

    private static final Logger log = LoggerFactory.getLogger(RescheduleBookingHandler.class);

    private final BookingRepository bookingRepository;
    private final AvailabilitySlotRepository slotRepository;
    private final Clock clock;

    public RescheduleBookingHandler(BookingRepository bookingRepository, AvailabilitySlotRepository slotRepository, Clock clock) {
        this.bookingRepository = bookingRepository;
        this.slotRepository = slotRepository;
        this.clock = clock;
    }

    @Override
    public Result<BookingResponse> handle(RescheduleBookingCommand command) {
        Booking booking = bookingRepository.findByIdForUpdate(command.bookingId()).orElse(null);
        if (booking == null) {
            return Result.notFound("BOOKING_NOT_FOUND");
        }
        if (booking.getStatus() != BookingStatus.CONFIRMED) {
            return Result.conflict("BOOKING_NOT_CONFIRMED");
        }
        if (booking.getSlotId().equals(command.newSlotId())) {
            return Result.failure("RESCHEDULE_SAME_SLOT");
        }
        UUID oldSlotId = booking.getSlotId();
        UUID newSlotId = command.newSlotId();
        // slots are always locked in id order so opposite reschedules cannot deadlock
        Optional<AvailabilitySlot> oldSlot;
        AvailabilitySlot newSlot;
        if (oldSlotId.compareTo(newSlotId) < 0) {
            oldSlot = slotRepository.findByIdForUpdate(oldSlotId);
            newSlot = slotRepository.findByIdForUpdate(newSlotId).orElse(null);
        } else {
            newSlot = slotRepository.findByIdForUpdate(newSlotId).orElse(null);
            oldSlot = slotRepository.findByIdForUpdate(oldSlotId);
        }
        if (newSlot == null) {
            return Result.notFound("SLOT_NOT_FOUND");
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        if (!newSlot.getCourseId().equals(booking.getCourseId())) {
            return Result.failure("SLOT_COURSE_MISMATCH");
        }
        if (!newSlot.isActive()) {
            return Result.conflict("SLOT_INACTIVE");
        }
        if (!newSlot.hasCapacity()) {
            return Result.conflict("SLOT_FULL");
        }
        if (!newSlot.getStartTimeUtc().isAfter(now)) {
            return Result.failure("SLOT_ALREADY_STARTED");
        }

        booking.reschedule(newSlot.getId(), now);
        bookingRepository.save(booking);

        oldSlot.filter(slot -> slot.getCurrentParticipants() > 0)
                .ifPresent(slot -> {
                    slot.removeParticipants(1, now);
                    slotRepository.save(slot);
                });
        newSlot.addParticipants(1, now);
        slotRepository.save(newSlot);

        Booking replacement = Booking.rescheduledFrom(booking, newSlot.getId(), newSlot.getInstructorId(), now);
        bookingRepository.save(replacement);
        log.info("Booking {} rescheduled to slot {} as booking {}", booking.getId(), newSlot.getId(), replacement.getId());
        return Result.success(BookingResponse.from(replacement));
    }
}
