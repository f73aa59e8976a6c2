package com.medicaledu.backend.modules.notifications.application;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import com.medicaledu.backend.modules.bookings.domain.BookingEvent;
import com.medicaledu.backend.modules.bookings.domain.BookingEvents;
import com.medicaledu.backend.modules.courses.domain.CourseEvent;
import com.medicaledu.backend.modules.courses.domain.CourseEvents;
import com.medicaledu.backend.modules.notifications.domain.NotificationType;
import com.medicaledu.backend.modules.payments.domain.PaymentEvent;
import com.medicaledu.backend.modules.payments.domain.PaymentEvents;

import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Turns booking, payment and course events into stored notifications. Runs synchronously so the
 * notification commits or rolls back with the change that caused it.
 */
@Component
public class NotificationEventListener {

    private final NotificationService notificationService;

    public NotificationEventListener(NotificationService notificationService) {
        this.notificationService = notificationService;
    }

    @EventListener
    public void onBookingCreated(BookingEvents.Created event) {
        if (event.rescheduledFromBookingId() != null) {
            return;
        }
        notificationService.notify(
                event.instructorId(),
                NotificationType.BOOKING_REQUESTED,
                "New booking request",
                "A student has booked one of your sessions.",
                event.aggregateId(),
                BookingEvent.AGGREGATE_TYPE,
                metadata("slotId", event.slotId(), "courseId", event.courseId())
        );
    }

    @EventListener
    public void onBookingConfirmed(BookingEvents.Confirmed event) {
        notificationService.notify(
                event.studentId(),
                NotificationType.BOOKING_CONFIRMATION,
                "Booking confirmed",
                "Your booking has been confirmed.",
                event.aggregateId(),
                BookingEvent.AGGREGATE_TYPE,
                null
        );
    }

    @EventListener
    public void onBookingCancelled(BookingEvents.Cancelled event) {
        // the party that did not cancel is told; an admin cancellation reaches the student
        UUID recipient = event.studentId().equals(event.cancelledBy()) ? event.instructorId() : event.studentId();
        notificationService.notify(
                recipient,
                NotificationType.BOOKING_CANCELLATION,
                "Booking cancelled",
                "A booking was cancelled: " + event.reason(),
                event.aggregateId(),
                BookingEvent.AGGREGATE_TYPE,
                metadata("reason", event.reason(), "cancelledBy", event.cancelledBy())
        );
    }

    @EventListener
    public void onBookingRescheduled(BookingEvents.Rescheduled event) {
        Map<String, Object> metadata = metadata("newSlotId", event.newSlotId(), null, null);
        notificationService.notify(
                event.studentId(),
                NotificationType.BOOKING_RESCHEDULED,
                "Booking rescheduled",
                "Your booking has been moved to a new time.",
                event.aggregateId(),
                BookingEvent.AGGREGATE_TYPE,
                metadata
        );
        notificationService.notify(
                event.instructorId(),
                NotificationType.BOOKING_RESCHEDULED,
                "Booking rescheduled",
                "A booking has been moved to a new time.",
                event.aggregateId(),
                BookingEvent.AGGREGATE_TYPE,
                metadata
        );
    }

    @EventListener
    public void onPaymentSucceeded(PaymentEvents.Succeeded event) {
        notificationService.notify(
                event.userId(),
                NotificationType.PAYMENT_CONFIRMATION,
                "Payment received",
                "We received your payment of " + event.amount().toPlainString() + " " + event.currency() + ".",
                event.aggregateId(),
                PaymentEvent.AGGREGATE_TYPE,
                metadata("bookingId", event.bookingId(), null, null)
        );
    }

    @EventListener
    public void onPaymentFailed(PaymentEvents.Failed event) {
        notificationService.notify(
                event.userId(),
                NotificationType.PAYMENT_FAILED,
                "Payment failed",
                "Your payment could not be processed: " + event.reason(),
                event.aggregateId(),
                PaymentEvent.AGGREGATE_TYPE,
                metadata("bookingId", event.bookingId(), "reason", event.reason())
        );
    }

    @EventListener
    public void onCoursePublished(CourseEvents.Published event) {
        notificationService.notify(
                event.instructorId(),
                NotificationType.COURSE_PUBLISHED,
                "Course published",
                "Your course \"" + event.title() + "\" is now visible to students.",
                event.aggregateId(),
                CourseEvent.AGGREGATE_TYPE,
                null
        );
    }

    private static Map<String, Object> metadata(String firstKey, Object firstValue, String secondKey, Object secondValue) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (firstKey != null && firstValue != null) {
            metadata.put(firstKey, firstValue.toString());
        }
        if (secondKey != null && secondValue != null) {
            metadata.put(secondKey, secondValue.toString());
        }
        return metadata;
    }
}
