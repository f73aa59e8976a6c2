package com.medicaledu.backend.modules.enrollments.application;

import java.time.Duration;
import java.util.UUID;

import com.medicaledu.backend.global.cache.CachePrefixes;
import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.CacheableQuery;
import com.medicaledu.backend.global.web.PageResponse;
import com.medicaledu.backend.modules.enrollments.presentation.dto.EnrollmentResponse;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

public record GetEnrollmentsQuery(UUID courseId, UUID userId, @Min(0) int page, @Min(1) @Max(100) int size)
        implements CacheableQuery<Result<PageResponse<EnrollmentResponse>>> {

    @Override
    public String cachePrefix() {
        return CachePrefixes.GET_ENROLLMENTS;
    }

    @Override
    public Duration cacheDuration() {
        return Duration.ofMinutes(10);
    }
}
