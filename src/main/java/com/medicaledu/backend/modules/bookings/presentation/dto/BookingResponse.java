package com.medicaledu.backend.modules.bookings.presentation.dto;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.medicaledu.backend.modules.bookings.domain.Booking;
import com.medicaledu.backend.modules.bookings.domain.BookingStatus;

public record BookingResponse(
        UUID id,
        UUID studentId,
        UUID instructorId,
        UUID slotId,
        UUID courseId,
        BookingStatus status,
        BigDecimal amount,
        String currency,
        BigDecimal discountAmount,
        String studentNotes,
        String instructorNotes,
        String meetingUrl,
        String meetingNotes,
        String cancellationReason,
        OffsetDateTime cancelledAt,
        OffsetDateTime confirmedAt,
        OffsetDateTime completedAt,
        UUID rescheduledFromBookingId,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static BookingResponse from(Booking booking) {
        return new BookingResponse(
                booking.getId(),
                booking.getStudentId(),
                booking.getInstructorId(),
                booking.getSlotId(),
                booking.getCourseId(),
                booking.getStatus(),
                booking.getAmount().getAmount(),
                booking.getAmount().getCurrency().getCode(),
                booking.getDiscountAmount() == null ? null : booking.getDiscountAmount().getAmount(),
                booking.getStudentNotes(),
                booking.getInstructorNotes(),
                booking.getMeetingUrl() == null ? null : booking.getMeetingUrl().getValue(),
                booking.getMeetingNotes(),
                booking.getCancellationReason(),
                booking.getCancelledAt(),
                booking.getConfirmedAt(),
                booking.getCompletedAt(),
                booking.getRescheduledFromBookingId(),
                booking.getCreatedAt(),
                booking.getUpdatedAt()
        );
    }
}
