package com.medicaledu.backend.modules.payments.presentation.dto;

public record SucceedPaymentRequest(String providerTransactionId) {
}
