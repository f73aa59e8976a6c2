package com.medicaledu.backend.modules.courses.application;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.medicaledu.backend.global.cache.CachePrefixes;
import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.CacheableQuery;
import com.medicaledu.backend.modules.courses.domain.CourseCategory;
import com.medicaledu.backend.modules.courses.presentation.dto.CoursePageResponse;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;

/**
 * Filtered, sorted course listing. Every filter is optional.
 */
public record GetAllCoursesQuery(
        @Min(0) int page,
        @Min(1) @Max(100) int pageSize,
        Boolean isPublished,
        Boolean isActive,
        UUID instructorId,
        String title,
        String description,
        CourseCategory category,
        @DecimalMin("0.00") BigDecimal minPrice,
        @DecimalMin("0.00") BigDecimal maxPrice,
        String currency,
        OffsetDateTime createdFrom,
        OffsetDateTime createdTo,
        OffsetDateTime publishedFrom,
        OffsetDateTime publishedTo,
        @Min(1) Integer minDuration,
        @Max(1440) Integer maxDuration,
        @Min(1) Integer minMaxStudents,
        @Max(1000) Integer maxMaxStudents,
        String sortBy,
        @Pattern(regexp = "(?i)asc|desc") String sortDirection
) implements CacheableQuery<Result<CoursePageResponse>> {

    public static final int DEFAULT_PAGE_SIZE = 25;

    public static GetAllCoursesQuery firstPage() {
        return new GetAllCoursesQuery(0, DEFAULT_PAGE_SIZE, null, null, null, null, null, null, null, null, null,
                null, null, null, null, null, null, null, null, null, null);
    }

    @Override
    public String cachePrefix() {
        return CachePrefixes.GET_ALL_COURSES;
    }

    @Override
    public Duration cacheDuration() {
        return Duration.ofMinutes(10);
    }
}
