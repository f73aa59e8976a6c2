package com.medicaledu.backend.modules.courses.application;

import java.time.Duration;
import java.util.UUID;

import com.medicaledu.backend.global.cache.CachePrefixes;
import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.CacheableQuery;
import com.medicaledu.backend.modules.courses.presentation.dto.CourseResponse;

import jakarta.validation.constraints.NotNull;

public record GetCourseByIdQuery(@NotNull UUID courseId) implements CacheableQuery<Result<CourseResponse>> {

    @Override
    public String cachePrefix() {
        return CachePrefixes.GET_COURSE_BY_ID;
    }

    @Override
    public Duration cacheDuration() {
        return Duration.ofMinutes(30);
    }

    @Override
    public String cacheKey() {
        return CachePrefixes.key(CachePrefixes.GET_COURSE_BY_ID, courseId);
    }
}
