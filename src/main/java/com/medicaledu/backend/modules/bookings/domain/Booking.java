package com.medicaledu.backend.modules.bookings.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.medicaledu.backend.global.common.domain.Money;
import com.medicaledu.backend.global.common.domain.Url;
import com.medicaledu.backend.global.jpa.AbstractAggregateEntity;

import jakarta.persistence.AttributeOverride;
import jakarta.persistence.AttributeOverrides;
import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * A student's seat on an availability slot.
 *
 * <p>Status moves forward only: PENDING to CONFIRMED, then to COMPLETED, NO_SHOW or
 * RESCHEDULED. PENDING and CONFIRMED bookings may be CANCELLED.</p>
 */
@Entity
@Table(name = "booking")
public class Booking extends AbstractAggregateEntity {

    public static final int NOTES_MAX_LENGTH = 1000;
    public static final int REASON_MAX_LENGTH = 500;

    @Id
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "student_id", nullable = false, columnDefinition = "uuid")
    private UUID studentId;

    @Column(name = "instructor_id", nullable = false, columnDefinition = "uuid")
    private UUID instructorId;

    @Column(name = "slot_id", nullable = false, columnDefinition = "uuid")
    private UUID slotId;

    @Column(name = "course_id", nullable = false, columnDefinition = "uuid")
    private UUID courseId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private BookingStatus status;

    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "amount", column = @Column(name = "amount", nullable = false, precision = 12, scale = 2)),
            @AttributeOverride(name = "currency", column = @Column(name = "currency", nullable = false, length = 3))
    })
    private Money amount;

    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "amount", column = @Column(name = "discount_amount", precision = 12, scale = 2)),
            @AttributeOverride(name = "currency", column = @Column(name = "discount_currency", length = 3))
    })
    private Money discountAmount;

    @Column(name = "student_notes", length = NOTES_MAX_LENGTH)
    private String studentNotes;

    @Column(name = "instructor_notes", length = NOTES_MAX_LENGTH)
    private String instructorNotes;

    @Column(name = "meeting_url", length = 2048)
    private Url meetingUrl;

    @Column(name = "meeting_notes", length = NOTES_MAX_LENGTH)
    private String meetingNotes;

    @Column(name = "cancellation_reason", length = REASON_MAX_LENGTH)
    private String cancellationReason;

    @Column(name = "cancelled_by", columnDefinition = "uuid")
    private UUID cancelledBy;

    @Column(name = "cancelled_at")
    private OffsetDateTime cancelledAt;

    @Column(name = "confirmed_at")
    private OffsetDateTime confirmedAt;

    @Column(name = "completed_at")
    private OffsetDateTime completedAt;

    @Column(name = "rescheduled_from_booking_id", columnDefinition = "uuid")
    private UUID rescheduledFromBookingId;

    protected Booking() {
    }

    public static Booking create(
            UUID studentId,
            UUID instructorId,
            UUID slotId,
            UUID courseId,
            Money amount,
            Money discountAmount,
            String studentNotes,
            UUID rescheduledFromBookingId,
            OffsetDateTime now
    ) {
        if (studentId == null || instructorId == null || slotId == null || courseId == null) {
            throw new IllegalArgumentException("Student, instructor, slot and course are required.");
        }
        if (amount == null) {
            throw new IllegalArgumentException("Amount is required.");
        }
        Booking booking = new Booking();
        booking.id = UUID.randomUUID();
        booking.studentId = studentId;
        booking.instructorId = instructorId;
        booking.slotId = slotId;
        booking.courseId = courseId;
        booking.status = BookingStatus.PENDING;
        booking.amount = amount;
        booking.discountAmount = discountAmount;
        booking.studentNotes = checkNotes(studentNotes);
        booking.rescheduledFromBookingId = rescheduledFromBookingId;
        booking.registerEvent(new BookingEvents.Created(
                booking.id, now, studentId, instructorId, slotId, courseId, rescheduledFromBookingId));
        return booking;
    }

    /**
     * Replacement for a rescheduled booking. Starts out confirmed since the original already was.
     */
    public static Booking rescheduledFrom(Booking original, UUID newSlotId, UUID instructorId, OffsetDateTime now) {
        if (original.status != BookingStatus.RESCHEDULED) {
            throw new IllegalStateException("Original booking must be rescheduled first.");
        }
        Booking booking = create(
                original.studentId,
                instructorId,
                newSlotId,
                original.courseId,
                original.amount,
                original.discountAmount,
                original.studentNotes,
                original.id,
                now
        );
        booking.status = BookingStatus.CONFIRMED;
        booking.confirmedAt = now;
        return booking;
    }

    public void confirm(OffsetDateTime now) {
        requireStatus(BookingStatus.PENDING, "Only pending bookings can be confirmed.");
        this.status = BookingStatus.CONFIRMED;
        this.confirmedAt = now;
        registerEvent(new BookingEvents.Confirmed(id, now, studentId, instructorId));
    }

    public void cancel(String reason, UUID cancelledBy, OffsetDateTime now) {
        if (status != BookingStatus.PENDING && status != BookingStatus.CONFIRMED) {
            throw new IllegalStateException("Only pending or confirmed bookings can be cancelled.");
        }
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("Cancellation reason is required.");
        }
        if (reason.length() > REASON_MAX_LENGTH) {
            throw new IllegalArgumentException("Cancellation reason must not exceed " + REASON_MAX_LENGTH + " characters.");
        }
        this.status = BookingStatus.CANCELLED;
        this.cancellationReason = reason.trim();
        this.cancelledBy = cancelledBy;
        this.cancelledAt = now;
        registerEvent(new BookingEvents.Cancelled(id, now, studentId, instructorId, cancelledBy, cancellationReason));
    }

    public void complete(OffsetDateTime now) {
        requireStatus(BookingStatus.CONFIRMED, "Only confirmed bookings can be completed.");
        this.status = BookingStatus.COMPLETED;
        this.completedAt = now;
        registerEvent(new BookingEvents.Completed(id, now));
    }

    public void markNoShow(OffsetDateTime now) {
        requireStatus(BookingStatus.CONFIRMED, "Only confirmed bookings can be marked as no-show.");
        this.status = BookingStatus.NO_SHOW;
        registerEvent(new BookingEvents.NoShow(id, now));
    }

    public void reschedule(UUID newSlotId, OffsetDateTime now) {
        requireStatus(BookingStatus.CONFIRMED, "Only confirmed bookings can be rescheduled.");
        if (newSlotId == null) {
            throw new IllegalArgumentException("New slot is required.");
        }
        if (newSlotId.equals(slotId)) {
            throw new IllegalArgumentException("New slot must differ from the current slot.");
        }
        this.status = BookingStatus.RESCHEDULED;
        registerEvent(new BookingEvents.Rescheduled(id, now, studentId, instructorId, newSlotId));
    }

    public void updateNotes(String studentNotes, String instructorNotes, OffsetDateTime now) {
        if (studentNotes != null) {
            this.studentNotes = checkNotes(studentNotes);
        }
        if (instructorNotes != null) {
            this.instructorNotes = checkNotes(instructorNotes);
        }
        registerEvent(new BookingEvents.NotesUpdated(id, now));
    }

    public void setMeeting(Url meetingUrl, String meetingNotes, OffsetDateTime now) {
        this.meetingUrl = meetingUrl;
        this.meetingNotes = checkNotes(meetingNotes);
        registerEvent(new BookingEvents.NotesUpdated(id, now));
    }

    public boolean isActive() {
        return status == BookingStatus.PENDING || status == BookingStatus.CONFIRMED;
    }

    public boolean involves(UUID userId) {
        return studentId.equals(userId) || instructorId.equals(userId);
    }

    private void requireStatus(BookingStatus expected, String message) {
        if (status != expected) {
            throw new IllegalStateException(message);
        }
    }

    private static String checkNotes(String notes) {
        if (notes == null || notes.isBlank()) {
            return null;
        }
        if (notes.length() > NOTES_MAX_LENGTH) {
            throw new IllegalArgumentException("Notes must not exceed " + NOTES_MAX_LENGTH + " characters.");
        }
        return notes.trim();
    }

    @Override
    public UUID getId() {
        return id;
    }

    public UUID getStudentId() {
        return studentId;
    }

    public UUID getInstructorId() {
        return instructorId;
    }

    public UUID getSlotId() {
        return slotId;
    }

    public UUID getCourseId() {
        return courseId;
    }

    public BookingStatus getStatus() {
        return status;
    }

    public Money getAmount() {
        return amount;
    }

    public Money getDiscountAmount() {
        return discountAmount;
    }

    public String getStudentNotes() {
        return studentNotes;
    }

    public String getInstructorNotes() {
        return instructorNotes;
    }

    public Url getMeetingUrl() {
        return meetingUrl;
    }

    public String getMeetingNotes() {
        return meetingNotes;
    }

    public String getCancellationReason() {
        return cancellationReason;
    }

    public UUID getCancelledBy() {
        return cancelledBy;
    }

    public OffsetDateTime getCancelledAt() {
        return cancelledAt;
    }

    public OffsetDateTime getConfirmedAt() {
        return confirmedAt;
    }

    public OffsetDateTime getCompletedAt() {
        return completedAt;
    }

    public UUID getRescheduledFromBookingId() {
        return rescheduledFromBookingId;
    }
}
