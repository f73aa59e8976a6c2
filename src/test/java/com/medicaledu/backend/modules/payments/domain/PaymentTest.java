package com.medicaledu.backend.modules.payments.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.medicaledu.backend.global.common.domain.AuditActionType;
import com.medicaledu.backend.global.common.domain.Currency;
import com.medicaledu.backend.global.common.domain.Money;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PaymentTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-03-01T09:00:00Z");

    private Payment payment;

    @BeforeEach
    void setUp() {
        payment = Payment.create(UUID.randomUUID(), UUID.randomUUID(), usd("100.00"), PaymentProvider.STRIPE, " ", NOW);
    }

    @Test
    void createStartsPending() {
        assertThat(payment.getStatus()).isEqualTo(PaymentStatus.PENDING);
        assertThat(payment.getProviderTransactionId()).isNull();
        assertThat(payment.getDomainEvents()).singleElement()
                .satisfies(event -> assertThat(event.auditAction()).isEqualTo(AuditActionType.CREATE));
    }

    @Test
    @DisplayName("success records the processor transaction id")
    void markSucceeded() {
        payment.markSucceeded(" pi_123 ", NOW);

        assertThat(payment.getStatus()).isEqualTo(PaymentStatus.SUCCEEDED);
        assertThat(payment.getProviderTransactionId()).isEqualTo("pi_123");
        assertThat(payment.getProcessedAt()).isEqualTo(NOW);
        assertThatThrownBy(() -> payment.markSucceeded("pi_456", NOW)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void markFailedNeedsReason() {
        assertThatThrownBy(() -> payment.markFailed("", NOW)).isInstanceOf(IllegalArgumentException.class);

        payment.markFailed("card declined", NOW);

        assertThat(payment.getStatus()).isEqualTo(PaymentStatus.FAILED);
        assertThat(payment.getFailureReason()).isEqualTo("card declined");
        assertThatThrownBy(() -> payment.cancel(NOW)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("partial refunds accumulate until the payment is fully refunded")
    void refundsAccumulate() {
        payment.markSucceeded("pi_1", NOW);

        payment.refund(usd("30.00"), "late start", NOW);
        assertThat(payment.getStatus()).isEqualTo(PaymentStatus.PARTIALLY_REFUNDED);
        assertThat(payment.getRefundableAmount()).isEqualTo(usd("70.00"));

        payment.refund(usd("70.00"), "session cancelled", NOW.plusDays(1));
        assertThat(payment.getStatus()).isEqualTo(PaymentStatus.REFUNDED);
        assertThat(payment.getRefundAmount()).isEqualTo(usd("100.00"));
        assertThat(payment.getRefundedAt()).isEqualTo(NOW.plusDays(1));
    }

    @Test
    void refundGuards() {
        assertThatThrownBy(() -> payment.refund(usd("10.00"), "early", NOW)).isInstanceOf(IllegalStateException.class);

        payment.markSucceeded("pi_1", NOW);
        assertThatThrownBy(() -> payment.refund(usd("100.01"), "too much", NOW))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> payment.refund(usd("0.00"), "zero", NOW))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> payment.refund(usd("5.00"), " ", NOW))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void cancelSucceededPayment() {
        payment.markSucceeded("pi_1", NOW);
        payment.cancel(NOW);

        assertThat(payment.getStatus()).isEqualTo(PaymentStatus.CANCELLED);
    }

    private static Money usd(String amount) {
        return Money.of(new BigDecimal(amount), Currency.USD);
    }
}
