package com.medicaledu.backend.modules.courses.application;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import com.medicaledu.backend.global.cache.CacheInvalidation;
import com.medicaledu.backend.global.cache.CachePrefixes;
import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.Command;
import com.medicaledu.backend.modules.courses.domain.CourseCategory;
import com.medicaledu.backend.modules.courses.domain.DifficultyLevel;
import com.medicaledu.backend.modules.courses.presentation.dto.CourseMaterialRequest;
import com.medicaledu.backend.modules.courses.presentation.dto.CourseResponse;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

@CacheInvalidation(prefixes = {
        CachePrefixes.GET_ALL_COURSES,
        CachePrefixes.GET_COURSE_BY_ID,
        CachePrefixes.GET_COURSES_BY_INSTRUCTOR,
        CachePrefixes.GET_COURSES_BY_CATEGORY
})
public record UpdateCourseCommand(
        @NotNull UUID courseId,
        @Size(min = 1, max = 200) String title,
        @Size(max = 2000) String description,
        @DecimalMin("0.00") BigDecimal price,
        @Size(min = 3, max = 3) String currency,
        @Min(1) @Max(1440) Integer durationMinutes,
        @Min(1) @Max(1000) Integer maxStudents,
        CourseCategory category,
        DifficultyLevel difficultyLevel,
        List<String> tags,
        String thumbnailUrl,
        String videoUrl,
        List<@Valid CourseMaterialRequest> materials
) implements Command<Result<CourseResponse>> {
}
