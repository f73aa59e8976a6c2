package com.medicaledu.backend.modules.bookings.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.medicaledu.backend.global.common.domain.AuditActionType;
import com.medicaledu.backend.global.common.domain.Currency;
import com.medicaledu.backend.global.common.domain.Money;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class BookingTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-03-01T09:00:00Z");

    private final UUID studentId = UUID.randomUUID();
    private final UUID instructorId = UUID.randomUUID();
    private final UUID slotId = UUID.randomUUID();
    private final UUID courseId = UUID.randomUUID();

    private Booking booking;

    @BeforeEach
    void setUp() {
        booking = Booking.create(studentId, instructorId, slotId, courseId,
                Money.of(new BigDecimal("120.00"), Currency.USD), null, "  first session  ", null, NOW);
    }

    @Test
    @DisplayName("a new booking is pending and announces itself")
    void createStartsPending() {
        assertThat(booking.getStatus()).isEqualTo(BookingStatus.PENDING);
        assertThat(booking.getStudentNotes()).isEqualTo("first session");
        assertThat(booking.isActive()).isTrue();
        assertThat(booking.getDomainEvents()).singleElement()
                .isInstanceOfSatisfying(BookingEvents.Created.class, event -> {
                    assertThat(event.aggregateId()).isEqualTo(booking.getId());
                    assertThat(event.auditAction()).isEqualTo(AuditActionType.BOOKING_CREATED);
                    assertThat(event.aggregateType()).isEqualTo("Booking");
                });
    }

    @Test
    void confirmThenComplete() {
        booking.confirm(NOW);
        assertThat(booking.getStatus()).isEqualTo(BookingStatus.CONFIRMED);
        assertThat(booking.getConfirmedAt()).isEqualTo(NOW);

        booking.complete(NOW.plusHours(2));
        assertThat(booking.getStatus()).isEqualTo(BookingStatus.COMPLETED);
        assertThat(booking.getCompletedAt()).isEqualTo(NOW.plusHours(2));
        assertThat(booking.isActive()).isFalse();
    }

    @Test
    @DisplayName("completion and no-show require a confirmed booking")
    void completeRequiresConfirmation() {
        assertThatThrownBy(() -> booking.complete(NOW)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> booking.markNoShow(NOW)).isInstanceOf(IllegalStateException.class);

        booking.confirm(NOW);
        assertThatThrownBy(() -> booking.confirm(NOW)).isInstanceOf(IllegalStateException.class);
        booking.markNoShow(NOW);
        assertThat(booking.getStatus()).isEqualTo(BookingStatus.NO_SHOW);
    }

    @Test
    void cancelRecordsWhoAndWhy() {
        booking.cancel("  schedule clash ", studentId, NOW);

        assertThat(booking.getStatus()).isEqualTo(BookingStatus.CANCELLED);
        assertThat(booking.getCancellationReason()).isEqualTo("schedule clash");
        assertThat(booking.getCancelledBy()).isEqualTo(studentId);
        assertThat(booking.getCancelledAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("cancelling needs a reason and an active booking")
    void cancelGuards() {
        assertThatThrownBy(() -> booking.cancel(" ", studentId, NOW)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> booking.cancel("x".repeat(501), studentId, NOW))
                .isInstanceOf(IllegalArgumentException.class);

        booking.cancel("changed plans", studentId, NOW);
        assertThatThrownBy(() -> booking.cancel("again", studentId, NOW)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("rescheduling retires the booking and the replacement starts confirmed")
    void rescheduleCreatesConfirmedReplacement() {
        booking.confirm(NOW);
        UUID newSlotId = UUID.randomUUID();

        booking.reschedule(newSlotId, NOW);
        Booking replacement = Booking.rescheduledFrom(booking, newSlotId, instructorId, NOW);

        assertThat(booking.getStatus()).isEqualTo(BookingStatus.RESCHEDULED);
        assertThat(replacement.getStatus()).isEqualTo(BookingStatus.CONFIRMED);
        assertThat(replacement.getSlotId()).isEqualTo(newSlotId);
        assertThat(replacement.getRescheduledFromBookingId()).isEqualTo(booking.getId());
        assertThat(replacement.getAmount()).isEqualTo(booking.getAmount());
        assertThat(replacement.getDomainEvents())
                .noneMatch(event -> event instanceof BookingEvents.Confirmed);
    }

    @Test
    void rescheduleGuards() {
        UUID otherSlot = UUID.randomUUID();
        assertThatThrownBy(() -> booking.reschedule(otherSlot, NOW)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> Booking.rescheduledFrom(booking, otherSlot, instructorId, NOW))
                .isInstanceOf(IllegalStateException.class);

        booking.confirm(NOW);
        assertThatThrownBy(() -> booking.reschedule(slotId, NOW)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> booking.reschedule(null, NOW)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("notes updates only touch the provided fields")
    void updateNotesIsPartial() {
        booking.updateNotes(null, "bring stethoscope", NOW);

        assertThat(booking.getStudentNotes()).isEqualTo("first session");
        assertThat(booking.getInstructorNotes()).isEqualTo("bring stethoscope");
        assertThatThrownBy(() -> booking.updateNotes("x".repeat(1001), null, NOW))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void involvesBothParticipants() {
        assertThat(booking.involves(studentId)).isTrue();
        assertThat(booking.involves(instructorId)).isTrue();
        assertThat(booking.involves(UUID.randomUUID())).isFalse();
    }
}
