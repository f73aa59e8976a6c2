package com.medicaledu.backend.modules.enrollments.application;

import java.time.Duration;
import java.util.UUID;

import com.medicaledu.backend.global.cache.CachePrefixes;
import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.CacheableQuery;
import com.medicaledu.backend.modules.enrollments.presentation.dto.EnrollmentResponse;

import jakarta.validation.constraints.NotNull;

public record GetEnrollmentByIdQuery(@NotNull UUID enrollmentId) implements CacheableQuery<Result<EnrollmentResponse>> {

    @Override
    public String cachePrefix() {
        return CachePrefixes.GET_ENROLLMENTS;
    }

    @Override
    public Duration cacheDuration() {
        return Duration.ofMinutes(10);
    }

    @Override
    public String cacheKey() {
        return CachePrefixes.key(CachePrefixes.GET_ENROLLMENTS, enrollmentId);
    }
}
