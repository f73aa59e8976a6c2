package com.medicaledu.backend.modules.payments.presentation.dto;

public record FailPaymentRequest(String reason) {
}
