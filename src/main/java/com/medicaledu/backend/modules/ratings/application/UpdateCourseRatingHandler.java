package com.medicaledu.backend.modules.ratings.application;

import java.time.Clock;
import java.time.OffsetDateTime;

import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.RequestHandler;
import com.medicaledu.backend.modules.ratings.domain.CourseRating;
import com.medicaledu.backend.modules.ratings.infrastructure.persistence.CourseRatingRepository;
import com.medicaledu.backend.modules.ratings.presentation.dto.RatingResponse;

import org.springframework.stereotype.Service;

@Service
public class UpdateCourseRatingHandler implements RequestHandler<UpdateCourseRatingCommand, Result<RatingResponse>> {

    private final CourseRatingRepository courseRatingRepository;
    private final Clock clock;

    public UpdateCourseRatingHandler(CourseRatingRepository courseRatingRepository, Clock clock) {
        this.courseRatingRepository = courseRatingRepository;
        this.clock = clock;
    }

    @Override
    public Result<RatingResponse> handle(UpdateCourseRatingCommand command) {
        CourseRating rating = courseRatingRepository.findById(command.ratingId()).orElse(null);
        if (rating == null) {
            return Result.notFound("RATING_NOT_FOUND");
        }
        if (!rating.getStudentId().equals(command.studentId())) {
            return Result.unauthorized("RATING_NOT_OWNED");
        }
        rating.update(command.rating(), command.review(), command.isPublic(), OffsetDateTime.now(clock));
        courseRatingRepository.save(rating);
        return Result.success(RatingResponse.from(rating));
    }
}
