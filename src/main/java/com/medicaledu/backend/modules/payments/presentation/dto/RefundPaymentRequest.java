package com.medicaledu.backend.modules.payments.presentation.dto;

import java.math.BigDecimal;

public record RefundPaymentRequest(BigDecimal amount, String reason) {
}
