package com.medicaledu.backend.modules.enrollments.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.medicaledu.backend.global.common.domain.Currency;
import com.medicaledu.backend.global.common.domain.Money;
import com.medicaledu.backend.global.common.domain.Url;
import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.common.result.ResultErrorType;
import com.medicaledu.backend.modules.courses.domain.Course;
import com.medicaledu.backend.modules.courses.domain.CourseMaterial;
import com.medicaledu.backend.modules.courses.domain.CourseMaterialDraft;
import com.medicaledu.backend.modules.courses.infrastructure.persistence.CourseRepository;
import com.medicaledu.backend.modules.enrollments.domain.CourseProgress;
import com.medicaledu.backend.modules.enrollments.domain.Enrollment;
import com.medicaledu.backend.modules.enrollments.infrastructure.persistence.CourseProgressRepository;
import com.medicaledu.backend.modules.enrollments.infrastructure.persistence.EnrollmentRepository;
import com.medicaledu.backend.modules.enrollments.presentation.dto.EnrollmentResponse;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RecordProgressHandlerTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-01-01T00:00:00Z");

    @Mock
    private EnrollmentRepository enrollmentRepository;

    @Mock
    private CourseProgressRepository progressRepository;

    @Mock
    private CourseRepository courseRepository;

    private RecordProgressHandler handler;

    private Course course;
    private CourseMaterial lecture;
    private CourseMaterial quiz;
    private Enrollment enrollment;

    @BeforeEach
    void setUp() {
        handler = new RecordProgressHandler(enrollmentRepository, progressRepository, courseRepository,
                Clock.fixed(NOW.toInstant(), ZoneOffset.UTC));
        course = Course.create(UUID.randomUUID(), "Emergency Airway", null,
                Money.of(new BigDecimal("199.00"), Currency.USD), 180, 15, null, null, null, null, null, NOW);
        lecture = course.addMaterial(draft("Lecture"), NOW);
        quiz = course.addMaterial(draft("Quiz"), NOW);
        enrollment = Enrollment.enroll(UUID.randomUUID(), course.getId(), NOW.minusDays(3));
    }

    @Test
    @DisplayName("completing one of two materials puts the enrollment at fifty percent")
    void completingMaterialUpdatesPercentage() {
        CourseProgress lectureProgress = CourseProgress.start(enrollment.getId(), lecture.getId());
        when(enrollmentRepository.findByIdForUpdate(enrollment.getId())).thenReturn(Optional.of(enrollment));
        when(courseRepository.findById(course.getId())).thenReturn(Optional.of(course));
        when(progressRepository.findByEnrollmentIdAndMaterialId(enrollment.getId(), lecture.getId()))
                .thenReturn(Optional.of(lectureProgress));
        when(progressRepository.findByEnrollmentId(enrollment.getId())).thenReturn(List.of(lectureProgress));

        Result<EnrollmentResponse> result = handler.handle(
                new RecordProgressCommand(enrollment.getId(), lecture.getId(), 600, true));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getValue().progressPercentage()).isEqualTo(50);
        assertThat(result.getValue().completedAt()).isNull();
        assertThat(lectureProgress.isCompleted()).isTrue();
        assertThat(lectureProgress.getTimeSpentSeconds()).isEqualTo(600);
        verify(progressRepository).save(lectureProgress);
        verify(enrollmentRepository).save(enrollment);
    }

    @Test
    void finishingLastMaterialCompletesEnrollment() {
        CourseProgress lectureProgress = CourseProgress.start(enrollment.getId(), lecture.getId());
        lectureProgress.markCompleted(NOW.minusDays(1));
        CourseProgress quizProgress = CourseProgress.start(enrollment.getId(), quiz.getId());
        when(enrollmentRepository.findByIdForUpdate(enrollment.getId())).thenReturn(Optional.of(enrollment));
        when(courseRepository.findById(course.getId())).thenReturn(Optional.of(course));
        when(progressRepository.findByEnrollmentIdAndMaterialId(enrollment.getId(), quiz.getId()))
                .thenReturn(Optional.of(quizProgress));
        when(progressRepository.findByEnrollmentId(enrollment.getId())).thenReturn(List.of(lectureProgress, quizProgress));

        Result<EnrollmentResponse> result = handler.handle(
                new RecordProgressCommand(enrollment.getId(), quiz.getId(), 0, true));

        assertThat(result.getValue().progressPercentage()).isEqualTo(100);
        assertThat(enrollment.isCompleted()).isTrue();
        assertThat(enrollment.getCompletedAt()).isEqualTo(NOW);
    }

    @Test
    void materialOutsideCourseIsNotFound() {
        when(enrollmentRepository.findByIdForUpdate(enrollment.getId())).thenReturn(Optional.of(enrollment));
        when(courseRepository.findById(course.getId())).thenReturn(Optional.of(course));

        Result<EnrollmentResponse> result = handler.handle(
                new RecordProgressCommand(enrollment.getId(), UUID.randomUUID(), 30, false));

        assertThat(result.getErrorType()).isEqualTo(ResultErrorType.NOT_FOUND);
        assertThat(result.getErrors()).containsExactly("MATERIAL_NOT_FOUND");
        verify(progressRepository, never()).save(any());
    }

    @Test
    void inactiveEnrollmentIsConflict() {
        enrollment.deactivate(NOW.minusDays(1));
        when(enrollmentRepository.findByIdForUpdate(enrollment.getId())).thenReturn(Optional.of(enrollment));

        Result<EnrollmentResponse> result = handler.handle(
                new RecordProgressCommand(enrollment.getId(), lecture.getId(), 30, false));

        assertThat(result.getErrorType()).isEqualTo(ResultErrorType.CONFLICT);
        assertThat(result.getErrors()).containsExactly("ENROLLMENT_INACTIVE");
    }

    private static CourseMaterialDraft draft(String title) {
        return new CourseMaterialDraft(title, null, Url.of("https://cdn.example.com/" + title),
                null, "video/mp4", 4096, null, false, true, 20);
    }
}
