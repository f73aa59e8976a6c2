package com.medicaledu.backend.modules.payments.application;

import java.util.UUID;

import com.medicaledu.backend.global.cache.CacheInvalidation;
import com.medicaledu.backend.global.cache.CachePrefixes;
import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.Command;
import com.medicaledu.backend.modules.payments.presentation.dto.PaymentResponse;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Records a captured payment and confirms the booking when it is still pending.
 */
@CacheInvalidation(prefixes = {CachePrefixes.GET_PAYMENTS, CachePrefixes.GET_PAYMENTS_BY_USER})
@CacheInvalidation(prefixes = {CachePrefixes.GET_BOOKINGS, CachePrefixes.GET_BOOKINGS_BY_USER, CachePrefixes.GET_BOOKINGS_BY_INSTRUCTOR})
@CacheInvalidation(prefixes = CachePrefixes.GET_NOTIFICATIONS_BY_USER)
public record SucceedPaymentCommand(@NotNull UUID paymentId, @Size(max = 255) String providerTransactionId)
        implements Command<Result<PaymentResponse>> {
}
