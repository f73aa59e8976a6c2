package com.medicaledu.backend.modules.enrollments.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.medicaledu.backend.global.jpa.AbstractAggregateEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

@Entity
@Table(name = "enrollment")
public class Enrollment extends AbstractAggregateEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "student_id", nullable = false, columnDefinition = "uuid")
    private UUID studentId;

    @Column(name = "course_id", nullable = false, columnDefinition = "uuid")
    private UUID courseId;

    @Column(name = "enrolled_at", nullable = false)
    private OffsetDateTime enrolledAt;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(name = "progress_percentage", nullable = false)
    private int progressPercentage;

    @Column(name = "completed_at")
    private OffsetDateTime completedAt;

    @Column(name = "last_accessed_at")
    private OffsetDateTime lastAccessedAt;

    protected Enrollment() {
    }

    public static Enrollment enroll(UUID studentId, UUID courseId, OffsetDateTime now) {
        if (studentId == null || courseId == null) {
            throw new IllegalArgumentException("Student and course are required.");
        }
        Enrollment enrollment = new Enrollment();
        enrollment.id = UUID.randomUUID();
        enrollment.studentId = studentId;
        enrollment.courseId = courseId;
        enrollment.enrolledAt = now;
        enrollment.lastAccessedAt = now;
        enrollment.registerEvent(new EnrollmentEvents.Enrolled(enrollment.id, now, studentId, courseId));
        return enrollment;
    }

    public boolean isCompleted() {
        return completedAt != null;
    }

    public void updateProgress(int percentage, OffsetDateTime now) {
        if (isCompleted()) {
            throw new IllegalStateException("Enrollment is already completed.");
        }
        if (percentage < 0 || percentage > 100) {
            throw new IllegalArgumentException("Progress must be between 0 and 100.");
        }
        this.progressPercentage = percentage;
        this.lastAccessedAt = now;
        registerEvent(new EnrollmentEvents.ProgressUpdated(id, now, percentage));
        if (percentage == 100) {
            complete(now);
        }
    }

    public void complete(OffsetDateTime now) {
        if (isCompleted()) {
            throw new IllegalStateException("Enrollment is already completed.");
        }
        this.progressPercentage = 100;
        this.completedAt = now;
        registerEvent(new EnrollmentEvents.Completed(id, now));
    }

    public void deactivate(OffsetDateTime now) {
        if (!active) {
            throw new IllegalStateException("Enrollment is already inactive.");
        }
        this.active = false;
        registerEvent(new EnrollmentEvents.Deactivated(id, now));
    }

    public void reactivate(OffsetDateTime now) {
        if (active) {
            throw new IllegalStateException("Enrollment is already active.");
        }
        this.active = true;
        registerEvent(new EnrollmentEvents.Reactivated(id, now));
    }

    public void recordAccess(OffsetDateTime now) {
        this.lastAccessedAt = now;
    }

    @Override
    public UUID getId() {
        return id;
    }

    public UUID getStudentId() {
        return studentId;
    }

    public UUID getCourseId() {
        return courseId;
    }

    public OffsetDateTime getEnrolledAt() {
        return enrolledAt;
    }

    public boolean isActive() {
        return active;
    }

    public int getProgressPercentage() {
        return progressPercentage;
    }

    public OffsetDateTime getCompletedAt() {
        return completedAt;
    }

    public OffsetDateTime getLastAccessedAt() {
        return lastAccessedAt;
    }
}
