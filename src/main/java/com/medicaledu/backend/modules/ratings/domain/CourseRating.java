package com.medicaledu.backend.modules.ratings.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.medicaledu.backend.global.jpa.AbstractAggregateEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

@Entity
@Table(
        name = "course_rating",
        uniqueConstraints = @UniqueConstraint(name = "uq_course_rating_course_student", columnNames = {"course_id", "student_id"})
)
public class CourseRating extends AbstractAggregateEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "course_id", nullable = false, columnDefinition = "uuid")
    private UUID courseId;

    @Column(name = "student_id", nullable = false, columnDefinition = "uuid")
    private UUID studentId;

    @Column(name = "rating", nullable = false)
    private int rating;

    @Column(name = "review", length = RatingRules.REVIEW_MAX_LENGTH)
    private String review;

    @Column(name = "is_public", nullable = false)
    private boolean publicRating = true;

    protected CourseRating() {
    }

    public static CourseRating rate(UUID courseId, UUID studentId, int rating, String review, boolean publicRating, OffsetDateTime now) {
        if (courseId == null || studentId == null) {
            throw new IllegalArgumentException("Course and student are required.");
        }
        CourseRating courseRating = new CourseRating();
        courseRating.id = UUID.randomUUID();
        courseRating.courseId = courseId;
        courseRating.studentId = studentId;
        courseRating.rating = RatingRules.checkRating(rating);
        courseRating.review = RatingRules.checkReview(review);
        courseRating.publicRating = publicRating;
        courseRating.registerEvent(new RatingEvents.CourseRated(courseRating.id, now, courseId, studentId, rating));
        return courseRating;
    }

    public void update(Integer rating, String review, Boolean publicRating, OffsetDateTime now) {
        if (rating != null) {
            this.rating = RatingRules.checkRating(rating);
        }
        if (review != null) {
            this.review = RatingRules.checkReview(review);
        }
        if (publicRating != null) {
            this.publicRating = publicRating;
        }
        registerEvent(new RatingEvents.CourseRatingUpdated(id, now, this.rating));
    }

    @Override
    public UUID getId() {
        return id;
    }

    public UUID getCourseId() {
        return courseId;
    }

    public UUID getStudentId() {
        return studentId;
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
