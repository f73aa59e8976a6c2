package com.medicaledu.backend.modules.enrollments.application;

import java.util.UUID;

import com.medicaledu.backend.global.cache.CacheInvalidation;
import com.medicaledu.backend.global.cache.CachePrefixes;
import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.Command;
import com.medicaledu.backend.modules.enrollments.presentation.dto.EnrollmentResponse;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

/**
 * Adds time spent on a material and optionally marks it completed, then recomputes the
 * enrollment percentage.
 */
@CacheInvalidation(prefixes = {CachePrefixes.GET_ENROLLMENTS, CachePrefixes.GET_ENROLLMENTS_BY_USER, CachePrefixes.GET_ENROLLMENTS_BY_COURSE})
public record RecordProgressCommand(
        @NotNull UUID enrollmentId,
        @NotNull UUID materialId,
        @Min(0) @Max(86_400) long secondsSpent,
        boolean completed
) implements Command<Result<EnrollmentResponse>> {
}
