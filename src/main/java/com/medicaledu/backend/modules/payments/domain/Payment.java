package com.medicaledu.backend.modules.payments.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.medicaledu.backend.global.common.domain.Money;
import com.medicaledu.backend.global.jpa.AbstractAggregateEntity;

import jakarta.persistence.AttributeOverride;
import jakarta.persistence.AttributeOverrides;
import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * Payment for a booking.
 *
 * <p>Refunds accumulate in {@code refundAmount}; the payment is {@code REFUNDED} once it reaches
 * the paid amount and {@code PARTIALLY_REFUNDED} before that.</p>
 */
@Entity
@Table(name = "payment")
public class Payment extends AbstractAggregateEntity {

    public static final int REASON_MAX_LENGTH = 500;

    @Id
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "booking_id", nullable = false, columnDefinition = "uuid")
    private UUID bookingId;

    @Column(name = "user_id", nullable = false, columnDefinition = "uuid")
    private UUID userId;

    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "amount", column = @Column(name = "amount", nullable = false, precision = 12, scale = 2)),
            @AttributeOverride(name = "currency", column = @Column(name = "currency", nullable = false, length = 3))
    })
    private Money amount;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private PaymentStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "provider", nullable = false, length = 20)
    private PaymentProvider provider;

    @Column(name = "provider_transaction_id", length = 255)
    private String providerTransactionId;

    @Column(name = "failure_reason", length = REASON_MAX_LENGTH)
    private String failureReason;

    @Column(name = "processed_at")
    private OffsetDateTime processedAt;

    @Column(name = "refunded_at")
    private OffsetDateTime refundedAt;

    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "amount", column = @Column(name = "refund_amount", precision = 12, scale = 2)),
            @AttributeOverride(name = "currency", column = @Column(name = "refund_currency", length = 3))
    })
    private Money refundAmount;

    @Column(name = "refund_reason", length = REASON_MAX_LENGTH)
    private String refundReason;

    protected Payment() {
    }

    public static Payment create(
            UUID bookingId,
            UUID userId,
            Money amount,
            PaymentProvider provider,
            String providerTransactionId,
            OffsetDateTime now
    ) {
        if (bookingId == null || userId == null) {
            throw new IllegalArgumentException("Booking and user are required.");
        }
        if (amount == null) {
            throw new IllegalArgumentException("Amount is required.");
        }
        if (provider == null) {
            throw new IllegalArgumentException("Provider is required.");
        }
        Payment payment = new Payment();
        payment.id = UUID.randomUUID();
        payment.bookingId = bookingId;
        payment.userId = userId;
        payment.amount = amount;
        payment.provider = provider;
        payment.providerTransactionId = blankToNull(providerTransactionId);
        payment.status = PaymentStatus.PENDING;
        payment.registerEvent(new PaymentEvents.Created(payment.id, now, bookingId, userId, provider));
        return payment;
    }

    public void markSucceeded(String providerTransactionId, OffsetDateTime now) {
        if (status != PaymentStatus.PENDING) {
            throw new IllegalStateException("Only pending payments can succeed.");
        }
        this.status = PaymentStatus.SUCCEEDED;
        this.processedAt = now;
        if (providerTransactionId != null && !providerTransactionId.isBlank()) {
            this.providerTransactionId = providerTransactionId.trim();
        }
        registerEvent(new PaymentEvents.Succeeded(
                id, now, bookingId, userId, amount.getAmount(), amount.getCurrency().getCode()));
    }

    public void markFailed(String reason, OffsetDateTime now) {
        if (status != PaymentStatus.PENDING) {
            throw new IllegalStateException("Only pending payments can fail.");
        }
        this.failureReason = requireReason(reason, "Failure reason is required.");
        this.status = PaymentStatus.FAILED;
        this.processedAt = now;
        registerEvent(new PaymentEvents.Failed(id, now, bookingId, userId, failureReason));
    }

    public void cancel(OffsetDateTime now) {
        if (status != PaymentStatus.PENDING && status != PaymentStatus.SUCCEEDED) {
            throw new IllegalStateException("Only pending or succeeded payments can be cancelled.");
        }
        this.status = PaymentStatus.CANCELLED;
        registerEvent(new PaymentEvents.Cancelled(id, now));
    }

    public Money getRefundableAmount() {
        return refundAmount == null ? amount : amount.subtract(refundAmount);
    }

    public void refund(Money refund, String reason, OffsetDateTime now) {
        if (status != PaymentStatus.SUCCEEDED && status != PaymentStatus.PARTIALLY_REFUNDED) {
            throw new IllegalStateException("Only succeeded or partially refunded payments can be refunded.");
        }
        if (refund == null || !refund.isPositive()) {
            throw new IllegalArgumentException("Refund amount must be positive.");
        }
        Money refundable = getRefundableAmount();
        if (refund.isGreaterThan(refundable)) {
            throw new IllegalArgumentException("Refund amount exceeds the refundable amount of " + refundable + ".");
        }
        this.refundReason = requireReason(reason, "Refund reason is required.");
        this.refundAmount = refundAmount == null ? refund : refundAmount.add(refund);
        this.refundedAt = now;
        boolean full = refundAmount.equals(amount);
        this.status = full ? PaymentStatus.REFUNDED : PaymentStatus.PARTIALLY_REFUNDED;
        registerEvent(new PaymentEvents.Refunded(id, now, refund.getAmount(), full));
    }

    private static String requireReason(String reason, String message) {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException(message);
        }
        if (reason.length() > REASON_MAX_LENGTH) {
            throw new IllegalArgumentException("Reason must not exceed " + REASON_MAX_LENGTH + " characters.");
        }
        return reason.trim();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    @Override
    public UUID getId() {
        return id;
    }

    public UUID getBookingId() {
        return bookingId;
    }

    public UUID getUserId() {
        return userId;
    }

    public Money getAmount() {
        return amount;
    }

    public PaymentStatus getStatus() {
        return status;
    }

    public PaymentProvider getProvider() {
        return provider;
    }

    public String getProviderTransactionId() {
        return providerTransactionId;
    }

    public String getFailureReason() {
        return failureReason;
    }

    public OffsetDateTime getProcessedAt() {
        return processedAt;
    }

    public OffsetDateTime getRefundedAt() {
        return refundedAt;
    }

    public Money getRefundAmount() {
        return refundAmount;
    }

    public String getRefundReason() {
        return refundReason;
    }
}
