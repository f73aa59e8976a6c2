package com.medicaledu.backend.modules.bookings.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import com.medicaledu.backend.global.common.domain.Currency;
import com.medicaledu.backend.global.common.domain.Money;
import com.medicaledu.backend.global.common.domain.PromoCodeValue;
import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.common.result.ResultErrorType;
import com.medicaledu.backend.modules.availability.domain.AvailabilitySlot;
import com.medicaledu.backend.modules.availability.infrastructure.persistence.AvailabilitySlotRepository;
import com.medicaledu.backend.modules.bookings.domain.Booking;
import com.medicaledu.backend.modules.bookings.domain.BookingStatus;
import com.medicaledu.backend.modules.bookings.infrastructure.persistence.BookingRepository;
import com.medicaledu.backend.modules.bookings.presentation.dto.BookingResponse;
import com.medicaledu.backend.modules.promotions.application.PromoCodeService;
import com.medicaledu.backend.modules.promotions.application.PromoCodeService.PromoQuote;
import com.medicaledu.backend.modules.promotions.domain.DiscountType;
import com.medicaledu.backend.modules.promotions.domain.PromoCode;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CreateBookingHandlerTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-01-01T00:00:00Z");

    @Mock
    private BookingRepository bookingRepository;

    @Mock
    private AvailabilitySlotRepository slotRepository;

    @Mock
    private PromoCodeService promoCodeService;

    private CreateBookingHandler handler;

    private final UUID studentId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW.toInstant(), ZoneOffset.UTC);
        handler = new CreateBookingHandler(bookingRepository, slotRepository, promoCodeService, clock);
    }

    @Test
    @DisplayName("booking a free seat takes a participant and stores a pending booking at full price")
    void createsPendingBooking() {
        AvailabilitySlot slot = slot(NOW.plusDays(2), 2);
        when(slotRepository.findByIdForUpdate(slot.getId())).thenReturn(Optional.of(slot));
        when(bookingRepository.existsBySlotIdAndStudentIdAndStatusIn(eq(slot.getId()), eq(studentId), anyCollection()))
                .thenReturn(false);
        when(bookingRepository.save(any(Booking.class))).thenAnswer(invocation -> invocation.getArgument(0));

        Result<BookingResponse> result = handler.handle(new CreateBookingCommand(studentId, slot.getId(), null, "hello"));

        assertThat(result.isSuccess()).isTrue();
        BookingResponse response = result.getValue();
        assertThat(response.status()).isEqualTo(BookingStatus.PENDING);
        assertThat(response.amount()).isEqualByComparingTo("100.00");
        assertThat(response.discountAmount()).isNull();
        assertThat(response.instructorId()).isEqualTo(slot.getInstructorId());
        assertThat(response.courseId()).isEqualTo(slot.getCourseId());
        assertThat(slot.getCurrentParticipants()).isEqualTo(1);
        verify(slotRepository).save(slot);
        verifyNoInteractions(promoCodeService);
    }

    @Test
    void appliesPromoCodeDiscount() {
        AvailabilitySlot slot = slot(NOW.plusDays(2), 2);
        PromoCode promo = PromoCode.create(PromoCodeValue.of("WELCOME10"), null, DiscountType.PERCENTAGE,
                BigDecimal.TEN, Currency.USD, null, NOW.minusDays(1), NOW.plusDays(1), null, NOW);
        PromoQuote quote = new PromoQuote(promo, Money.of(new BigDecimal("10.00"), Currency.USD));
        when(slotRepository.findByIdForUpdate(slot.getId())).thenReturn(Optional.of(slot));
        when(bookingRepository.existsBySlotIdAndStudentIdAndStatusIn(any(), any(), anyCollection())).thenReturn(false);
        when(promoCodeService.quote("WELCOME10", slot.getCourseId(), slot.getPrice(), NOW))
                .thenReturn(Result.success(quote));
        when(bookingRepository.save(any(Booking.class))).thenAnswer(invocation -> invocation.getArgument(0));

        Result<BookingResponse> result = handler.handle(new CreateBookingCommand(studentId, slot.getId(), "WELCOME10", null));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getValue().amount()).isEqualByComparingTo("90.00");
        assertThat(result.getValue().discountAmount()).isEqualByComparingTo("10.00");
        verify(promoCodeService).redeem(quote, result.getValue().id(), NOW);
    }

    @Test
    void rejectedPromoCodeLeavesSlotUntouched() {
        AvailabilitySlot slot = slot(NOW.plusDays(2), 2);
        when(slotRepository.findByIdForUpdate(slot.getId())).thenReturn(Optional.of(slot));
        when(bookingRepository.existsBySlotIdAndStudentIdAndStatusIn(any(), any(), anyCollection())).thenReturn(false);
        when(promoCodeService.quote(eq("EXPIRED1"), any(), any(), any()))
                .thenReturn(Result.failure("PROMO_CODE_EXPIRED"));

        Result<BookingResponse> result = handler.handle(new CreateBookingCommand(studentId, slot.getId(), "EXPIRED1", null));

        assertThat(result.getErrors()).containsExactly("PROMO_CODE_EXPIRED");
        assertThat(slot.getCurrentParticipants()).isZero();
        verify(bookingRepository, never()).save(any());
        verify(slotRepository, never()).save(any());
    }

    @Test
    void missingSlotIsNotFound() {
        UUID slotId = UUID.randomUUID();
        when(slotRepository.findByIdForUpdate(slotId)).thenReturn(Optional.empty());

        Result<BookingResponse> result = handler.handle(new CreateBookingCommand(studentId, slotId, null, null));

        assertThat(result.getErrorType()).isEqualTo(ResultErrorType.NOT_FOUND);
        assertThat(result.getErrors()).containsExactly("SLOT_NOT_FOUND");
    }

    @Test
    void fullSlotIsConflict() {
        AvailabilitySlot slot = slot(NOW.plusDays(2), 1);
        slot.addParticipants(1, NOW);
        when(slotRepository.findByIdForUpdate(slot.getId())).thenReturn(Optional.of(slot));

        Result<BookingResponse> result = handler.handle(new CreateBookingCommand(studentId, slot.getId(), null, null));

        assertThat(result.getErrorType()).isEqualTo(ResultErrorType.CONFLICT);
        assertThat(result.getErrors()).containsExactly("SLOT_FULL");
    }

    @Test
    void inactiveSlotIsConflict() {
        AvailabilitySlot slot = slot(NOW.plusDays(2), 2);
        slot.deactivate(NOW);
        when(slotRepository.findByIdForUpdate(slot.getId())).thenReturn(Optional.of(slot));

        Result<BookingResponse> result = handler.handle(new CreateBookingCommand(studentId, slot.getId(), null, null));

        assertThat(result.getErrors()).containsExactly("SLOT_INACTIVE");
    }

    @Test
    void slotInThePastIsRejected() {
        AvailabilitySlot slot = slot(NOW.minusHours(1), 2);
        when(slotRepository.findByIdForUpdate(slot.getId())).thenReturn(Optional.of(slot));

        Result<BookingResponse> result = handler.handle(new CreateBookingCommand(studentId, slot.getId(), null, null));

        assertThat(result.getErrorType()).isEqualTo(ResultErrorType.FAILURE);
        assertThat(result.getErrors()).containsExactly("SLOT_ALREADY_STARTED");
    }

    @Test
    void duplicateActiveBookingIsConflict() {
        AvailabilitySlot slot = slot(NOW.plusDays(2), 3);
        when(slotRepository.findByIdForUpdate(slot.getId())).thenReturn(Optional.of(slot));
        when(bookingRepository.existsBySlotIdAndStudentIdAndStatusIn(eq(slot.getId()), eq(studentId), anyCollection()))
                .thenReturn(true);

        Result<BookingResponse> result = handler.handle(new CreateBookingCommand(studentId, slot.getId(), null, null));

        assertThat(result.getErrorType()).isEqualTo(ResultErrorType.CONFLICT);
        assertThat(result.getErrors()).containsExactly("BOOKING_ALREADY_EXISTS");
        assertThat(slot.getCurrentParticipants()).isZero();
    }

    private AvailabilitySlot slot(OffsetDateTime start, int maxParticipants) {
        return AvailabilitySlot.create(UUID.randomUUID(), UUID.randomUUID(), start, start.plusHours(1),
                Money.of(new BigDecimal("100.00"), Currency.USD), maxParticipants, null, NOW.minusDays(7));
    }
}
