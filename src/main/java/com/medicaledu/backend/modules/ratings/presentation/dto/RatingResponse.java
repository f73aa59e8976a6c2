package com.medicaledu.backend.modules.ratings.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.medicaledu.backend.modules.ratings.domain.CourseRating;
import com.medicaledu.backend.modules.ratings.domain.InstructorRating;

/**
 * Either kind of rating. {@code subjectId} is the course or the instructor rated.
 */
public record RatingResponse(
        UUID id,
        UUID subjectId,
        UUID studentId,
        UUID bookingId,
        int rating,
        String review,
        boolean isPublic,
        OffsetDateTime createdAt
) {

    public static RatingResponse from(CourseRating rating) {
        return new RatingResponse(
                rating.getId(),
                rating.getCourseId(),
                rating.getStudentId(),
                null,
                rating.getRating(),
                rating.getReview(),
                rating.isPublicRating(),
                rating.getCreatedAt()
        );
    }

    public static RatingResponse from(InstructorRating rating) {
        return new RatingResponse(
                rating.getId(),
                rating.getInstructorId(),
                rating.getStudentId(),
                rating.getBookingId(),
                rating.getRating(),
                rating.getReview(),
                rating.isPublicRating(),
                rating.getCreatedAt()
        );
    }
}
