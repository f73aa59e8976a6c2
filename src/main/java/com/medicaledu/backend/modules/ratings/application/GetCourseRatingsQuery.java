package com.medicaledu.backend.modules.ratings.application;

import java.time.Duration;
import java.util.UUID;

import com.medicaledu.backend.global.cache.CachePrefixes;
import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.CacheableQuery;
import com.medicaledu.backend.modules.ratings.presentation.dto.RatingSummaryResponse;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

public record GetCourseRatingsQuery(@NotNull UUID courseId, @Min(0) int page, @Min(1) @Max(100) int size)
        implements CacheableQuery<Result<RatingSummaryResponse>> {

    @Override
    public String cachePrefix() {
        return CachePrefixes.GET_COURSE_RATINGS;
    }

    @Override
    public Duration cacheDuration() {
        return Duration.ofMinutes(15);
    }
}
