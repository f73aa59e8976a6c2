package com.medicaledu.backend.modules.payments.application;

import java.util.UUID;

import com.medicaledu.backend.global.cache.CacheInvalidation;
import com.medicaledu.backend.global.cache.CachePrefixes;
import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.Command;
import com.medicaledu.backend.modules.payments.presentation.dto.PaymentResponse;

import jakarta.validation.constraints.NotNull;

@CacheInvalidation(prefixes = {CachePrefixes.GET_PAYMENTS, CachePrefixes.GET_PAYMENTS_BY_USER})
public record CancelPaymentCommand(@NotNull UUID paymentId) implements Command<Result<PaymentResponse>> {
}
