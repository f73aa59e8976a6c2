package com.medicaledu.backend.modules.payments.presentation.dto;

import java.util.UUID;

import com.medicaledu.backend.modules.payments.domain.PaymentProvider;

public record CreatePaymentRequest(UUID bookingId, PaymentProvider provider, String providerTransactionId) {
}
