package com.medicaledu.backend.modules.ratings.application;

import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.RequestHandler;
import com.medicaledu.backend.global.web.PageResponse;
import com.medicaledu.backend.modules.ratings.infrastructure.persistence.CourseRatingRepository;
import com.medicaledu.backend.modules.ratings.presentation.dto.RatingResponse;
import com.medicaledu.backend.modules.ratings.presentation.dto.RatingSummaryResponse;

import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
public class GetCourseRatingsHandler implements RequestHandler<GetCourseRatingsQuery, Result<RatingSummaryResponse>> {

    private final CourseRatingRepository courseRatingRepository;

    public GetCourseRatingsHandler(CourseRatingRepository courseRatingRepository) {
        this.courseRatingRepository = courseRatingRepository;
    }

    @Override
    public Result<RatingSummaryResponse> handle(GetCourseRatingsQuery query) {
        PageRequest pageRequest = PageRequest.of(query.page(), query.size(), Sort.by(Sort.Direction.DESC, "createdAt"));
        PageResponse<RatingResponse> ratings = PageResponse.from(
                courseRatingRepository.findByCourseIdAndPublicRatingTrue(query.courseId(), pageRequest), RatingResponse::from);
        return Result.success(RatingSummaryResponse.of(
                courseRatingRepository.averageRating(query.courseId()),
                courseRatingRepository.countByCourseIdAndPublicRatingTrue(query.courseId()),
                ratings
        ));
    }
}
