package com.medicaledu.backend.modules.courses.application;

import java.time.Duration;

import com.medicaledu.backend.global.cache.CachePrefixes;
import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.CacheableQuery;
import com.medicaledu.backend.modules.courses.domain.CourseCategory;
import com.medicaledu.backend.modules.courses.presentation.dto.CoursePageResponse;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

/**
 * Published, active courses in one category.
 */
public record GetCoursesByCategoryQuery(@NotNull CourseCategory category, @Min(0) int page, @Min(1) @Max(100) int pageSize)
        implements CacheableQuery<Result<CoursePageResponse>> {

    @Override
    public String cachePrefix() {
        return CachePrefixes.GET_COURSES_BY_CATEGORY;
    }

    @Override
    public Duration cacheDuration() {
        return Duration.ofMinutes(10);
    }
}
