package com.medicaledu.backend.modules.payments.presentation.dto;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.medicaledu.backend.modules.payments.domain.Payment;
import com.medicaledu.backend.modules.payments.domain.PaymentProvider;
import com.medicaledu.backend.modules.payments.domain.PaymentStatus;

public record PaymentResponse(
        UUID id,
        UUID bookingId,
        UUID userId,
        BigDecimal amount,
        String currency,
        PaymentStatus status,
        PaymentProvider provider,
        String providerTransactionId,
        String failureReason,
        OffsetDateTime processedAt,
        OffsetDateTime refundedAt,
        BigDecimal refundAmount,
        String refundReason,
        OffsetDateTime createdAt
) {

    public static PaymentResponse from(Payment payment) {
        return new PaymentResponse(
                payment.getId(),
                payment.getBookingId(),
                payment.getUserId(),
                payment.getAmount().getAmount(),
                payment.getAmount().getCurrency().getCode(),
                payment.getStatus(),
                payment.getProvider(),
                payment.getProviderTransactionId(),
                payment.getFailureReason(),
                payment.getProcessedAt(),
                payment.getRefundedAt(),
                payment.getRefundAmount() == null ? null : payment.getRefundAmount().getAmount(),
                payment.getRefundReason(),
                payment.getCreatedAt()
        );
    }
}
