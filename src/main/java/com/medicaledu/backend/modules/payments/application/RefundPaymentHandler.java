package com.medicaledu.backend.modules.payments.application;

import java.time.Clock;
import java.time.OffsetDateTime;

import com.medicaledu.backend.global.common.domain.Money;
import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.RequestHandler;
import com.medicaledu.backend.modules.payments.domain.Payment;
import com.medicaledu.backend.modules.payments.domain.PaymentStatus;
import com.medicaledu.backend.modules.payments.infrastructure.persistence.PaymentRepository;
import com.medicaledu.backend.modules.payments.presentation.dto.PaymentResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class RefundPaymentHandler implements RequestHandler<RefundPaymentCommand, Result<PaymentResponse>> {

    private static final Logger log = LoggerFactory.getLogger(RefundPaymentHandler.class);

    private final PaymentRepository paymentRepository;
    private final Clock clock;

    public RefundPaymentHandler(PaymentRepository paymentRepository, Clock clock) {
        this.paymentRepository = paymentRepository;
        this.clock = clock;
    }

    @Override
    public Result<PaymentResponse> handle(RefundPaymentCommand command) {
        Payment payment = paymentRepository.findByIdForUpdate(command.paymentId()).orElse(null);
        if (payment == null) {
            return Result.notFound("PAYMENT_NOT_FOUND");
        }
        if (payment.getStatus() != PaymentStatus.SUCCEEDED && payment.getStatus() != PaymentStatus.PARTIALLY_REFUNDED) {
            return Result.conflict("PAYMENT_NOT_REFUNDABLE");
        }
        Money refund = Money.of(command.amount(), payment.getAmount().getCurrency());
        if (refund.isGreaterThan(payment.getRefundableAmount())) {
            return Result.failure("REFUND_EXCEEDS_REFUNDABLE_AMOUNT");
        }
        payment.refund(refund, command.reason(), OffsetDateTime.now(clock));
        paymentRepository.save(payment);
        log.info("Refunded {} on payment {} (status {})", refund, payment.getId(), payment.getStatus());
        return Result.success(PaymentResponse.from(payment));
    }
}
