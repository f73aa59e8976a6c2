package com.medicaledu.backend.modules.courses.application;

import java.time.Duration;
import java.util.UUID;

import com.medicaledu.backend.global.cache.CachePrefixes;
import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.CacheableQuery;
import com.medicaledu.backend.modules.courses.presentation.dto.CoursePageResponse;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

public record GetCoursesByInstructorQuery(@NotNull UUID instructorId, @Min(0) int page, @Min(1) @Max(100) int pageSize)
        implements CacheableQuery<Result<CoursePageResponse>> {

    @Override
    public String cachePrefix() {
        return CachePrefixes.GET_COURSES_BY_INSTRUCTOR;
    }

    @Override
    public Duration cacheDuration() {
        return Duration.ofMinutes(10);
    }
}
