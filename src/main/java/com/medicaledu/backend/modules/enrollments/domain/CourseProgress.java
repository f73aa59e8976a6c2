package com.medicaledu.backend.modules.enrollments.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.medicaledu.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import org.hibernate.annotations.UuidGenerator;

/**
 * Progress of one enrollment through one course material.
 */
@Entity
@Table(
        name = "course_progress",
        uniqueConstraints = @UniqueConstraint(name = "uq_course_progress_enrollment_material",
                columnNames = {"enrollment_id", "material_id"})
)
public class CourseProgress extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "enrollment_id", nullable = false, columnDefinition = "uuid")
    private UUID enrollmentId;

    @Column(name = "material_id", nullable = false, columnDefinition = "uuid")
    private UUID materialId;

    @Column(name = "is_completed", nullable = false)
    private boolean completed;

    @Column(name = "completed_at")
    private OffsetDateTime completedAt;

    @Column(name = "time_spent_seconds", nullable = false)
    private long timeSpentSeconds;

    protected CourseProgress() {
    }

    public static CourseProgress start(UUID enrollmentId, UUID materialId) {
        if (enrollmentId == null || materialId == null) {
            throw new IllegalArgumentException("Enrollment and material are required.");
        }
        CourseProgress progress = new CourseProgress();
        progress.enrollmentId = enrollmentId;
        progress.materialId = materialId;
        return progress;
    }

    public void markCompleted(OffsetDateTime now) {
        if (completed) {
            return;
        }
        this.completed = true;
        this.completedAt = now;
    }

    public void addTime(long seconds) {
        if (seconds <= 0) {
            throw new IllegalArgumentException("Time spent must be positive.");
        }
        this.timeSpentSeconds += seconds;
    }

    public void reset() {
        this.completed = false;
        this.completedAt = null;
        this.timeSpentSeconds = 0;
    }

    public UUID getId() {
        return id;
    }

    public UUID getEnrollmentId() {
        return enrollmentId;
    }

    public UUID getMaterialId() {
        return materialId;
    }

    public boolean isCompleted() {
        return completed;
    }

    public OffsetDateTime getCompletedAt() {
        return completedAt;
    }

    public long getTimeSpentSeconds() {
        return timeSpentSeconds;
    }
}
