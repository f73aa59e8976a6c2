package com.medicaledu.backend.modules.enrollments.application;

import java.util.UUID;

import com.medicaledu.backend.global.cache.CacheInvalidation;
import com.medicaledu.backend.global.cache.CachePrefixes;
import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.Command;
import com.medicaledu.backend.modules.enrollments.presentation.dto.EnrollmentResponse;

import jakarta.validation.constraints.NotNull;

@CacheInvalidation(prefixes = {CachePrefixes.GET_ENROLLMENTS, CachePrefixes.GET_ENROLLMENTS_BY_USER, CachePrefixes.GET_ENROLLMENTS_BY_COURSE})
public record CompleteEnrollmentCommand(@NotNull UUID enrollmentId) implements Command<Result<EnrollmentResponse>> {
}
