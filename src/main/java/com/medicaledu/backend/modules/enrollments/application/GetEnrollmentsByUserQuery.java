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
import jakarta.validation.constraints.NotNull;

public record GetEnrollmentsByUserQuery(@NotNull UUID userId, @Min(0) int page, @Min(1) @Max(100) int size)
        implements CacheableQuery<Result<PageResponse<EnrollmentResponse>>> {

    @Override
    public String cachePrefix() {
        return CachePrefixes.GET_ENROLLMENTS_BY_USER;
    }

    @Override
    public Duration cacheDuration() {
        return Duration.ofMinutes(10);
    }
}
