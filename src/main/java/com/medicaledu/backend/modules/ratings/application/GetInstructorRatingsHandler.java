package com.medicaledu.backend.modules.ratings.application;

import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.RequestHandler;
import com.medicaledu.backend.global.web.PageResponse;
import com.medicaledu.backend.modules.ratings.infrastructure.persistence.InstructorRatingRepository;
import com.medicaledu.backend.modules.ratings.presentation.dto.RatingResponse;
import com.medicaledu.backend.modules.ratings.presentation.dto.RatingSummaryResponse;

import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
public class GetInstructorRatingsHandler implements RequestHandler<GetInstructorRatingsQuery, Result<RatingSummaryResponse>> {

    private final InstructorRatingRepository instructorRatingRepository;

    public GetInstructorRatingsHandler(InstructorRatingRepository instructorRatingRepository) {
        this.instructorRatingRepository = instructorRatingRepository;
    }

    @Override
    public Result<RatingSummaryResponse> handle(GetInstructorRatingsQuery query) {
        PageRequest pageRequest = PageRequest.of(query.page(), query.size(), Sort.by(Sort.Direction.DESC, "createdAt"));
        PageResponse<RatingResponse> ratings = PageResponse.from(
                instructorRatingRepository.findByInstructorIdAndPublicRatingTrue(query.instructorId(), pageRequest), RatingResponse::from);
        return Result.success(RatingSummaryResponse.of(
                instructorRatingRepository.averageRating(query.instructorId()),
                instructorRatingRepository.countByInstructorIdAndPublicRatingTrue(query.instructorId()),
                ratings
        ));
    }
}
