package com.medicaledu.backend.modules.payments.application;

import java.time.Duration;
import java.util.UUID;

import com.medicaledu.backend.global.cache.CachePrefixes;
import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.CacheableQuery;
import com.medicaledu.backend.modules.payments.presentation.dto.PaymentResponse;

import jakarta.validation.constraints.NotNull;

public record GetPaymentByIdQuery(@NotNull UUID paymentId) implements CacheableQuery<Result<PaymentResponse>> {

    @Override
    public String cachePrefix() {
        return CachePrefixes.GET_PAYMENTS;
    }

    @Override
    public Duration cacheDuration() {
        return Duration.ofMinutes(5);
    }

    @Override
    public String cacheKey() {
        return CachePrefixes.key(CachePrefixes.GET_PAYMENTS, paymentId);
    }
}
