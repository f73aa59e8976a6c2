package com.medicaledu.backend.modules.enrollments.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.OffsetDateTime;
import java.util.UUID;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class EnrollmentTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-03-01T09:00:00Z");

    @Test
    void enrollStartsActiveAtZero() {
        Enrollment enrollment = Enrollment.enroll(UUID.randomUUID(), UUID.randomUUID(), NOW);

        assertThat(enrollment.isActive()).isTrue();
        assertThat(enrollment.getProgressPercentage()).isZero();
        assertThat(enrollment.isCompleted()).isFalse();
        assertThat(enrollment.getEnrolledAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("reaching 100 percent completes the enrollment")
    void fullProgressCompletes() {
        Enrollment enrollment = Enrollment.enroll(UUID.randomUUID(), UUID.randomUUID(), NOW);

        enrollment.updateProgress(40, NOW);
        assertThat(enrollment.isCompleted()).isFalse();

        enrollment.updateProgress(100, NOW.plusDays(3));
        assertThat(enrollment.isCompleted()).isTrue();
        assertThat(enrollment.getCompletedAt()).isEqualTo(NOW.plusDays(3));
        assertThat(enrollment.getDomainEvents())
                .anyMatch(event -> event instanceof EnrollmentEvents.Completed);
    }

    @Test
    void progressGuards() {
        Enrollment enrollment = Enrollment.enroll(UUID.randomUUID(), UUID.randomUUID(), NOW);

        assertThatThrownBy(() -> enrollment.updateProgress(101, NOW)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> enrollment.updateProgress(-1, NOW)).isInstanceOf(IllegalArgumentException.class);

        enrollment.complete(NOW);
        assertThat(enrollment.getProgressPercentage()).isEqualTo(100);
        assertThatThrownBy(() -> enrollment.updateProgress(50, NOW)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> enrollment.complete(NOW)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void deactivateAndReactivate() {
        Enrollment enrollment = Enrollment.enroll(UUID.randomUUID(), UUID.randomUUID(), NOW);

        enrollment.deactivate(NOW);
        assertThat(enrollment.isActive()).isFalse();
        assertThatThrownBy(() -> enrollment.deactivate(NOW)).isInstanceOf(IllegalStateException.class);

        enrollment.reactivate(NOW);
        assertThat(enrollment.isActive()).isTrue();
        assertThatThrownBy(() -> enrollment.reactivate(NOW)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("material progress accumulates time and stays completed once done")
    void courseProgressTracksTime() {
        CourseProgress progress = CourseProgress.start(UUID.randomUUID(), UUID.randomUUID());

        progress.addTime(120);
        progress.addTime(30);
        progress.markCompleted(NOW);

        assertThat(progress.getTimeSpentSeconds()).isEqualTo(150);
        assertThat(progress.isCompleted()).isTrue();
        assertThat(progress.getCompletedAt()).isEqualTo(NOW);
        assertThatThrownBy(() -> progress.addTime(0)).isInstanceOf(IllegalArgumentException.class);

        progress.reset();
        assertThat(progress.isCompleted()).isFalse();
        assertThat(progress.getTimeSpentSeconds()).isZero();
    }
}
