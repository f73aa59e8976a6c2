package com.medicaledu.backend.modules.bookings.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.EnumSet;

import com.medicaledu.backend.global.common.domain.Money;
import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.RequestHandler;
import com.medicaledu.backend.modules.availability.domain.AvailabilitySlot;
import com.medicaledu.backend.modules.availability.infrastructure.persistence.AvailabilitySlotRepository;
import com.medicaledu.backend.modules.bookings.domain.Booking;
import com.medicaledu.backend.modules.bookings.domain.BookingStatus;
import com.medicaledu.backend.modules.bookings.infrastructure.persistence.BookingRepository;
import com.medicaledu.backend.modules.bookings.presentation.dto.BookingResponse;
import com.medicaledu.backend.modules.promotions.application.PromoCodeService;
import com.medicaledu.backend.modules.promotions.application.PromoCodeService.PromoQuote;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class CreateBookingHandler implements RequestHandler<CreateBookingCommand, Result<BookingResponse>> {

    private static final Logger log = LoggerFactory.getLogger(CreateBookingHandler.class);

    private final BookingRepository bookingRepository;
    private final AvailabilitySlotRepository slotRepository;
    private final PromoCodeService promoCodeService;
    private final Clock clock;

    public CreateBookingHandler(
            BookingRepository bookingRepository,
            AvailabilitySlotRepository slotRepository,
            PromoCodeService promoCodeService,
            Clock clock
    ) {
        this.bookingRepository = bookingRepository;
        this.slotRepository = slotRepository;
        this.promoCodeService = promoCodeService;
        this.clock = clock;
    }

    @Override
    public Result<BookingResponse> handle(CreateBookingCommand command) {
        AvailabilitySlot slot = slotRepository.findByIdForUpdate(command.slotId()).orElse(null);
        if (slot == null) {
            return Result.notFound("SLOT_NOT_FOUND");
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        if (!slot.isActive()) {
            return Result.conflict("SLOT_INACTIVE");
        }
        if (!slot.hasCapacity()) {
            return Result.conflict("SLOT_FULL");
        }
        if (!slot.getStartTimeUtc().isAfter(now)) {
            return Result.failure("SLOT_ALREADY_STARTED");
        }
        if (bookingRepository.existsBySlotIdAndStudentIdAndStatusIn(
                slot.getId(), command.studentId(), EnumSet.of(BookingStatus.PENDING, BookingStatus.CONFIRMED))) {
            return Result.conflict("BOOKING_ALREADY_EXISTS");
        }

        Money price = slot.getPrice();
        PromoQuote quote = null;
        if (command.promoCode() != null && !command.promoCode().isBlank()) {
            Result<PromoQuote> quoted = promoCodeService.quote(command.promoCode(), slot.getCourseId(), price, now);
            if (quoted.isFailure()) {
                return quoted.castFailure();
            }
            quote = quoted.getValue();
        }
        Money discount = quote == null ? null : quote.discount();
        Money amount = discount == null ? price : price.subtract(discount);

        slot.addParticipants(1, now);
        slotRepository.save(slot);

        Booking booking = bookingRepository.save(Booking.create(
                command.studentId(),
                slot.getInstructorId(),
                slot.getId(),
                slot.getCourseId(),
                amount,
                discount,
                command.notes(),
                null,
                now
        ));
        if (quote != null) {
            promoCodeService.redeem(quote, booking.getId(), now);
        }
        log.info("Booking {} created for student {} on slot {}", booking.getId(), command.studentId(), slot.getId());
        return Result.success(BookingResponse.from(booking));
    }
}
