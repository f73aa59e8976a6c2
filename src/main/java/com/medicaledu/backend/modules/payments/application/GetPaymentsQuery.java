package com.medicaledu.backend.modules.payments.application;

import java.time.Duration;

import com.medicaledu.backend.global.cache.CachePrefixes;
import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.CacheableQuery;
import com.medicaledu.backend.global.web.PageResponse;
import com.medicaledu.backend.modules.payments.domain.PaymentStatus;
import com.medicaledu.backend.modules.payments.presentation.dto.PaymentResponse;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

public record GetPaymentsQuery(PaymentStatus status, @Min(0) int page, @Min(1) @Max(100) int size)
        implements CacheableQuery<Result<PageResponse<PaymentResponse>>> {

    @Override
    public String cachePrefix() {
        return CachePrefixes.GET_PAYMENTS;
    }

    @Override
    public Duration cacheDuration() {
        return Duration.ofMinutes(5);
    }
}
