package com.medicaledu.backend.modules.payments.domain;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.medicaledu.backend.global.common.domain.AuditActionType;

public final class PaymentEvents {

    private PaymentEvents() {
    }

    public record Created(UUID aggregateId, OffsetDateTime occurredAt, UUID bookingId, UUID userId, PaymentProvider provider)
            implements PaymentEvent {
        @Override
        public AuditActionType auditAction() {
            return AuditActionType.CREATE;
        }
    }

    public record Succeeded(
            UUID aggregateId,
            OffsetDateTime occurredAt,
            UUID bookingId,
            UUID userId,
            BigDecimal amount,
            String currency
    ) implements PaymentEvent {
    }

    public record Failed(UUID aggregateId, OffsetDateTime occurredAt, UUID bookingId, UUID userId, String reason)
            implements PaymentEvent {
    }

    public record Cancelled(UUID aggregateId, OffsetDateTime occurredAt) implements PaymentEvent {
    }

    public record Refunded(UUID aggregateId, OffsetDateTime occurredAt, BigDecimal refundAmount, boolean fullRefund)
            implements PaymentEvent {
    }
}
