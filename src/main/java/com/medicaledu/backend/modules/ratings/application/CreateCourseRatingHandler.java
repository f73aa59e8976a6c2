package com.medicaledu.backend.modules.ratings.application;

import java.time.Clock;
import java.time.OffsetDateTime;

import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.RequestHandler;
import com.medicaledu.backend.modules.enrollments.infrastructure.persistence.EnrollmentRepository;
import com.medicaledu.backend.modules.ratings.domain.CourseRating;
import com.medicaledu.backend.modules.ratings.infrastructure.persistence.CourseRatingRepository;
import com.medicaledu.backend.modules.ratings.presentation.dto.RatingResponse;

import org.springframework.stereotype.Service;

@Service
public class CreateCourseRatingHandler implements RequestHandler<CreateCourseRatingCommand, Result<RatingResponse>> {

    private final CourseRatingRepository courseRatingRepository;
    private final EnrollmentRepository enrollmentRepository;
    private final Clock clock;

    public CreateCourseRatingHandler(
            CourseRatingRepository courseRatingRepository,
            EnrollmentRepository enrollmentRepository,
            Clock clock
    ) {
        this.courseRatingRepository = courseRatingRepository;
        this.enrollmentRepository = enrollmentRepository;
        this.clock = clock;
    }

    @Override
    public Result<RatingResponse> handle(CreateCourseRatingCommand command) {
        if (!enrollmentRepository.existsByStudentIdAndCourseId(command.studentId(), command.courseId())) {
            return Result.failure("NOT_ENROLLED_IN_COURSE");
        }
        if (courseRatingRepository.existsByCourseIdAndStudentId(command.courseId(), command.studentId())) {
            return Result.conflict("RATING_ALREADY_EXISTS");
        }
        CourseRating rating = courseRatingRepository.save(CourseRating.rate(
                command.courseId(),
                command.studentId(),
                command.rating(),
                command.review(),
                command.isPublic(),
                OffsetDateTime.now(clock)
        ));
        return Result.success(RatingResponse.from(rating));
    }
}
