package com.medicaledu.backend.modules.notifications.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

import com.medicaledu.backend.global.common.domain.Currency;
import com.medicaledu.backend.global.common.domain.Money;
import com.medicaledu.backend.modules.bookings.domain.Booking;
import com.medicaledu.backend.modules.bookings.domain.BookingEvent;
import com.medicaledu.backend.modules.bookings.domain.BookingEvents;
import com.medicaledu.backend.modules.notifications.domain.NotificationType;
import com.medicaledu.backend.modules.payments.domain.PaymentEvent;
import com.medicaledu.backend.modules.payments.domain.PaymentEvents;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class NotificationEventListenerTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-01-01T00:00:00Z");

    @Mock
    private NotificationService notificationService;

    private NotificationEventListener listener;

    private final UUID studentId = UUID.randomUUID();
    private final UUID instructorId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        listener = new NotificationEventListener(notificationService);
    }

    @Test
    @SuppressWarnings("unchecked")
    void newBookingNotifiesInstructor() {
        Booking booking = booking(null);
        BookingEvents.Created created = (BookingEvents.Created) booking.getDomainEvents().get(0);

        listener.onBookingCreated(created);

        ArgumentCaptor<Map<String, Object>> metadata = ArgumentCaptor.forClass(Map.class);
        verify(notificationService).notify(eq(instructorId), eq(NotificationType.BOOKING_REQUESTED), anyString(),
                anyString(), eq(booking.getId()), eq(BookingEvent.AGGREGATE_TYPE), metadata.capture());
        assertThat(metadata.getValue())
                .containsEntry("slotId", booking.getSlotId().toString())
                .containsEntry("courseId", booking.getCourseId().toString());
    }

    @Test
    void replacementBookingDoesNotNotifyAgain() {
        Booking replacement = booking(UUID.randomUUID());

        listener.onBookingCreated((BookingEvents.Created) replacement.getDomainEvents().get(0));

        verifyNoInteractions(notificationService);
    }

    @Test
    void studentCancellationIsSentToInstructor() {
        Booking booking = booking(null);
        booking.cancel("schedule clash", studentId, NOW);
        BookingEvents.Cancelled cancelled = (BookingEvents.Cancelled) booking.getDomainEvents().get(1);

        listener.onBookingCancelled(cancelled);

        verify(notificationService).notify(eq(instructorId), eq(NotificationType.BOOKING_CANCELLATION), anyString(),
                eq("A booking was cancelled: schedule clash"), eq(booking.getId()), anyString(), any());
    }

    @Test
    void instructorCancellationIsSentToStudent() {
        Booking booking = booking(null);
        booking.cancel("instructor unavailable", instructorId, NOW);

        listener.onBookingCancelled((BookingEvents.Cancelled) booking.getDomainEvents().get(1));

        verify(notificationService).notify(eq(studentId), eq(NotificationType.BOOKING_CANCELLATION), anyString(),
                anyString(), eq(booking.getId()), anyString(), any());
    }

    @Test
    void paymentSuccessMentionsAmount() {
        UUID paymentId = UUID.randomUUID();
        UUID bookingId = UUID.randomUUID();

        listener.onPaymentSucceeded(new PaymentEvents.Succeeded(paymentId, NOW, bookingId, studentId,
                new BigDecimal("75.50"), "EUR"));

        verify(notificationService).notify(eq(studentId), eq(NotificationType.PAYMENT_CONFIRMATION), anyString(),
                eq("We received your payment of 75.50 EUR."), eq(paymentId), eq(PaymentEvent.AGGREGATE_TYPE),
                eq(Map.of("bookingId", bookingId.toString())));
    }

    private Booking booking(UUID rescheduledFrom) {
        return Booking.create(studentId, instructorId, UUID.randomUUID(), UUID.randomUUID(),
                Money.of(new BigDecimal("75.50"), Currency.EUR), null, null, rescheduledFrom, NOW);
    }
}
