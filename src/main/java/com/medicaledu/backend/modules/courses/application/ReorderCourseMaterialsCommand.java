package com.medicaledu.backend.modules.courses.application;

import java.util.List;
import java.util.UUID;

import com.medicaledu.backend.global.cache.CacheInvalidation;
import com.medicaledu.backend.global.cache.CachePrefixes;
import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.Command;
import com.medicaledu.backend.modules.courses.presentation.dto.CourseResponse;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

@CacheInvalidation(prefixes = {CachePrefixes.GET_COURSE_BY_ID, CachePrefixes.GET_ALL_COURSES})
public record ReorderCourseMaterialsCommand(@NotNull UUID courseId, @NotEmpty List<@NotNull UUID> materialIds)
        implements Command<Result<CourseResponse>> {
}
