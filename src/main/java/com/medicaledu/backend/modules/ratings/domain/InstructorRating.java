package com.medicaledu.backend.modules.ratings.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.medicaledu.backend.global.jpa.AbstractAggregateEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * Rating a student leaves for an instructor after a completed booking. One per booking.
 */
@Entity
@Table(name = "instructor_rating")
public class InstructorRating extends AbstractAggregateEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "instructor_id", nullable = false, columnDefinition = "uuid")
    private UUID instructorId;

    @Column(name = "student_id", nullable = false, columnDefinition = "uuid")
    private UUID studentId;

    @Column(name = "booking_id", nullable = false, unique = true, columnDefinition = "uuid")
    private UUID bookingId;

    @Column(name = "rating", nullable = false)
    private int rating;

    @Column(name = "review", length = RatingRules.REVIEW_MAX_LENGTH)
    private String review;

    @Column(name = "is_public", nullable = false)
    private boolean publicRating = true;

    protected InstructorRating() {
    }

    public static InstructorRating rate(
            UUID instructorId,
            UUID studentId,
            UUID bookingId,
            int rating,
            String review,
            boolean publicRating,
            OffsetDateTime now
    ) {
        if (instructorId == null || studentId == null || bookingId == null) {
            throw new IllegalArgumentException("Instructor, student and booking are required.");
        }
        InstructorRating instructorRating = new InstructorRating();
        instructorRating.id = UUID.randomUUID();
        instructorRating.instructorId = instructorId;
        instructorRating.studentId = studentId;
        instructorRating.bookingId = bookingId;
        instructorRating.rating = RatingRules.checkRating(rating);
        instructorRating.review = RatingRules.checkReview(review);
        instructorRating.publicRating = publicRating;
        instructorRating.registerEvent(new RatingEvents.InstructorRated(instructorRating.id, now, instructorId, bookingId, rating));
        return instructorRating;
    }

    @Override
    public UUID getId() {
        return id;
    }

    public UUID getInstructorId() {
        return instructorId;
    }

    public UUID getStudentId() {
        return studentId;
    }

    public UUID getBookingId() {
        return bookingId;
    }

    public int getRating() {
        return rating;
    }

    public String getReview() {
        return review;
    }

    public boolean isPublicRating() {
        return publicRating;
    }
}
