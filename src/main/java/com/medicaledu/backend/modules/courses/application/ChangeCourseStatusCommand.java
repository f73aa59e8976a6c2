package com.medicaledu.backend.modules.courses.application;

import java.util.UUID;

import com.medicaledu.backend.global.cache.CacheInvalidation;
import com.medicaledu.backend.global.cache.CachePrefixes;
import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.Command;
import com.medicaledu.backend.modules.courses.presentation.dto.CourseResponse;

import jakarta.validation.constraints.NotNull;

@CacheInvalidation(prefixes = {
        CachePrefixes.GET_ALL_COURSES,
        CachePrefixes.GET_COURSE_BY_ID,
        CachePrefixes.GET_COURSES_BY_INSTRUCTOR,
        CachePrefixes.GET_COURSES_BY_CATEGORY
})
@CacheInvalidation(prefixes = CachePrefixes.GET_NOTIFICATIONS_BY_USER)
public record ChangeCourseStatusCommand(@NotNull UUID courseId, @NotNull CourseStatusAction action)
        implements Command<Result<CourseResponse>> {
}
