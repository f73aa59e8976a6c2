package com.medicaledu.backend.modules.ratings.application;

import java.util.UUID;

import com.medicaledu.backend.global.cache.CacheInvalidation;
import com.medicaledu.backend.global.cache.CachePrefixes;
import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.Command;
import com.medicaledu.backend.modules.ratings.presentation.dto.RatingResponse;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Partial update of a course rating by its author.
 */
@CacheInvalidation(prefixes = CachePrefixes.GET_COURSE_RATINGS)
public record UpdateCourseRatingCommand(
        @NotNull UUID ratingId,
        @NotNull UUID studentId,
        @Min(1) @Max(5) Integer rating,
        @Size(max = 2000) String review,
        Boolean isPublic
) implements Command<Result<RatingResponse>> {
}
