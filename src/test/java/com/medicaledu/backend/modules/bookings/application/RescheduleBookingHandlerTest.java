package com.medicaledu.backend.modules.bookings.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import com.medicaledu.backend.global.common.domain.Currency;
import com.medicaledu.backend.global.common.domain.Money;
import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.common.result.ResultErrorType;
import com.medicaledu.backend.modules.availability.domain.AvailabilitySlot;
import com.medicaledu.backend.modules.availability.infrastructure.persistence.AvailabilitySlotRepository;
import com.medicaledu.backend.modules.bookings.domain.Booking;
import com.medicaledu.backend.modules.bookings.domain.BookingStatus;
import com.medicaledu.backend.modules.bookings.infrastructure.persistence.BookingRepository;
import com.medicaledu.backend.modules.bookings.presentation.dto.BookingResponse;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RescheduleBookingHandlerTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-01-01T00:00:00Z");

    @Mock
    private BookingRepository bookingRepository;

    @Mock
    private AvailabilitySlotRepository slotRepository;

    private RescheduleBookingHandler handler;

    private final UUID courseId = UUID.randomUUID();
    private final UUID instructorId = UUID.randomUUID();

    private AvailabilitySlot oldSlot;
    private Booking booking;

    @BeforeEach
    void setUp() {
        handler = new RescheduleBookingHandler(bookingRepository, slotRepository,
                Clock.fixed(NOW.toInstant(), ZoneOffset.UTC));
        oldSlot = slot(courseId, NOW.plusDays(1));
        oldSlot.addParticipants(1, NOW);
        booking = Booking.create(UUID.randomUUID(), instructorId, oldSlot.getId(), courseId,
                Money.of(new BigDecimal("80.00"), Currency.USD), null, "prep notes", null, NOW.minusDays(2));
        booking.confirm(NOW.minusDays(1));
    }

    @Test
    @DisplayName("rescheduling moves the seat and yields a confirmed replacement linked to the original")
    void movesBookingToNewSlot() {
        AvailabilitySlot newSlot = slot(courseId, NOW.plusDays(3));
        when(bookingRepository.findByIdForUpdate(booking.getId())).thenReturn(Optional.of(booking));
        when(slotRepository.findByIdForUpdate(newSlot.getId())).thenReturn(Optional.of(newSlot));
        when(slotRepository.findByIdForUpdate(oldSlot.getId())).thenReturn(Optional.of(oldSlot));

        Result<BookingResponse> result = handler.handle(new RescheduleBookingCommand(booking.getId(), newSlot.getId()));

        assertThat(result.isSuccess()).isTrue();
        BookingResponse replacement = result.getValue();
        assertThat(replacement.id()).isNotEqualTo(booking.getId());
        assertThat(replacement.status()).isEqualTo(BookingStatus.CONFIRMED);
        assertThat(replacement.slotId()).isEqualTo(newSlot.getId());
        assertThat(replacement.rescheduledFromBookingId()).isEqualTo(booking.getId());
        assertThat(replacement.amount()).isEqualByComparingTo("80.00");
        assertThat(replacement.studentNotes()).isEqualTo("prep notes");

        assertThat(booking.getStatus()).isEqualTo(BookingStatus.RESCHEDULED);
        assertThat(oldSlot.getCurrentParticipants()).isZero();
        assertThat(newSlot.getCurrentParticipants()).isEqualTo(1);
        verify(bookingRepository).save(booking);
        verify(slotRepository).save(oldSlot);
        verify(slotRepository).save(newSlot);
    }

    @Test
    @DisplayName("both slots are locked in id order whichever direction the booking moves")
    void locksSlotsInIdOrder() {
        AvailabilitySlot newSlot = slot(courseId, NOW.plusDays(3));
        when(bookingRepository.findByIdForUpdate(booking.getId())).thenReturn(Optional.of(booking));
        when(slotRepository.findByIdForUpdate(newSlot.getId())).thenReturn(Optional.of(newSlot));
        when(slotRepository.findByIdForUpdate(oldSlot.getId())).thenReturn(Optional.of(oldSlot));

        handler.handle(new RescheduleBookingCommand(booking.getId(), newSlot.getId()));

        UUID first = oldSlot.getId().compareTo(newSlot.getId()) < 0 ? oldSlot.getId() : newSlot.getId();
        UUID second = first.equals(oldSlot.getId()) ? newSlot.getId() : oldSlot.getId();
        InOrder lockOrder = inOrder(slotRepository);
        lockOrder.verify(slotRepository).findByIdForUpdate(first);
        lockOrder.verify(slotRepository).findByIdForUpdate(second);
        verify(slotRepository, times(2)).findByIdForUpdate(any());
    }

    @Test
    void onlyConfirmedBookingsMove() {
        Booking pending = Booking.create(UUID.randomUUID(), instructorId, oldSlot.getId(), courseId,
                Money.of(new BigDecimal("80.00"), Currency.USD), null, null, null, NOW);
        when(bookingRepository.findByIdForUpdate(pending.getId())).thenReturn(Optional.of(pending));

        Result<BookingResponse> result = handler.handle(new RescheduleBookingCommand(pending.getId(), UUID.randomUUID()));

        assertThat(result.getErrorType()).isEqualTo(ResultErrorType.CONFLICT);
        assertThat(result.getErrors()).containsExactly("BOOKING_NOT_CONFIRMED");
    }

    @Test
    void sameSlotIsRejected() {
        when(bookingRepository.findByIdForUpdate(booking.getId())).thenReturn(Optional.of(booking));

        Result<BookingResponse> result = handler.handle(new RescheduleBookingCommand(booking.getId(), oldSlot.getId()));

        assertThat(result.getErrors()).containsExactly("RESCHEDULE_SAME_SLOT");
        assertThat(booking.getStatus()).isEqualTo(BookingStatus.CONFIRMED);
    }

    @Test
    void slotOfAnotherCourseIsRejected() {
        AvailabilitySlot foreign = slot(UUID.randomUUID(), NOW.plusDays(3));
        when(bookingRepository.findByIdForUpdate(booking.getId())).thenReturn(Optional.of(booking));
        when(slotRepository.findByIdForUpdate(foreign.getId())).thenReturn(Optional.of(foreign));
        when(slotRepository.findByIdForUpdate(oldSlot.getId())).thenReturn(Optional.of(oldSlot));

        Result<BookingResponse> result = handler.handle(new RescheduleBookingCommand(booking.getId(), foreign.getId()));

        assertThat(result.getErrors()).containsExactly("SLOT_COURSE_MISMATCH");
        verify(bookingRepository, never()).save(any());
    }

    @Test
    void fullTargetSlotIsConflict() {
        AvailabilitySlot full = slot(courseId, NOW.plusDays(3));
        full.addParticipants(2, NOW);
        when(bookingRepository.findByIdForUpdate(booking.getId())).thenReturn(Optional.of(booking));
        when(slotRepository.findByIdForUpdate(full.getId())).thenReturn(Optional.of(full));
        when(slotRepository.findByIdForUpdate(oldSlot.getId())).thenReturn(Optional.of(oldSlot));

        Result<BookingResponse> result = handler.handle(new RescheduleBookingCommand(booking.getId(), full.getId()));

        assertThat(result.getErrorType()).isEqualTo(ResultErrorType.CONFLICT);
        assertThat(result.getErrors()).containsExactly("SLOT_FULL");
    }

    @Test
    void unknownBookingIsNotFound() {
        UUID bookingId = UUID.randomUUID();
        when(bookingRepository.findByIdForUpdate(bookingId)).thenReturn(Optional.empty());

        Result<BookingResponse> result = handler.handle(new RescheduleBookingCommand(bookingId, UUID.randomUUID()));

        assertThat(result.getErrorType()).isEqualTo(ResultErrorType.NOT_FOUND);
        assertThat(result.getErrors()).containsExactly("BOOKING_NOT_FOUND");
    }

    private AvailabilitySlot slot(UUID slotCourseId, OffsetDateTime start) {
        return AvailabilitySlot.create(slotCourseId, instructorId, start, start.plusHours(1),
                Money.of(new BigDecimal("80.00"), Currency.USD), 2, null, NOW.minusDays(10));
    }
}
