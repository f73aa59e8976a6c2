package com.medicaledu.backend.modules.ratings.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.common.result.ResultErrorType;
import com.medicaledu.backend.modules.enrollments.infrastructure.persistence.EnrollmentRepository;
import com.medicaledu.backend.modules.ratings.domain.CourseRating;
import com.medicaledu.backend.modules.ratings.infrastructure.persistence.CourseRatingRepository;
import com.medicaledu.backend.modules.ratings.presentation.dto.RatingResponse;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CreateCourseRatingHandlerTest {

    @Mock
    private CourseRatingRepository courseRatingRepository;

    @Mock
    private EnrollmentRepository enrollmentRepository;

    private CreateCourseRatingHandler handler;

    private final UUID courseId = UUID.randomUUID();
    private final UUID studentId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2025-01-01T00:00:00Z"), ZoneOffset.UTC);
        handler = new CreateCourseRatingHandler(courseRatingRepository, enrollmentRepository, clock);
    }

    @Test
    void enrolledStudentRatesCourse() {
        when(enrollmentRepository.existsByStudentIdAndCourseId(studentId, courseId)).thenReturn(true);
        when(courseRatingRepository.existsByCourseIdAndStudentId(courseId, studentId)).thenReturn(false);
        when(courseRatingRepository.save(any(CourseRating.class))).thenAnswer(invocation -> invocation.getArgument(0));

        Result<RatingResponse> result = handler.handle(
                new CreateCourseRatingCommand(courseId, studentId, 4, "Clear demonstrations", true));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getValue().subjectId()).isEqualTo(courseId);
        assertThat(result.getValue().rating()).isEqualTo(4);
        assertThat(result.getValue().isPublic()).isTrue();
    }

    @Test
    void studentWithoutEnrollmentCannotRate() {
        when(enrollmentRepository.existsByStudentIdAndCourseId(studentId, courseId)).thenReturn(false);

        Result<RatingResponse> result = handler.handle(new CreateCourseRatingCommand(courseId, studentId, 5, null, true));

        assertThat(result.getErrors()).containsExactly("NOT_ENROLLED_IN_COURSE");
        verify(courseRatingRepository, never()).save(any());
    }

    @Test
    void secondRatingForSameCourseConflicts() {
        when(enrollmentRepository.existsByStudentIdAndCourseId(studentId, courseId)).thenReturn(true);
        when(courseRatingRepository.existsByCourseIdAndStudentId(courseId, studentId)).thenReturn(true);

        Result<RatingResponse> result = handler.handle(new CreateCourseRatingCommand(courseId, studentId, 3, null, false));

        assertThat(result.getErrorType()).isEqualTo(ResultErrorType.CONFLICT);
        assertThat(result.getErrors()).containsExactly("RATING_ALREADY_EXISTS");
    }
}
