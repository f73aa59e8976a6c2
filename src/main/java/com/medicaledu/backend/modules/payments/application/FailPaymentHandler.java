package com.medicaledu.backend.modules.payments.application;

import java.time.Clock;
import java.time.OffsetDateTime;

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
public class FailPaymentHandler implements RequestHandler<FailPaymentCommand, Result<PaymentResponse>> {

    private static final Logger log = LoggerFactory.getLogger(FailPaymentHandler.class);

    private final PaymentRepository paymentRepository;
    private final Clock clock;

    public FailPaymentHandler(PaymentRepository paymentRepository, Clock clock) {
        this.paymentRepository = paymentRepository;
        this.clock = clock;
    }

    @Override
    public Result<PaymentResponse> handle(FailPaymentCommand command) {
        Payment payment = paymentRepository.findByIdForUpdate(command.paymentId()).orElse(null);
        if (payment == null) {
            return Result.notFound("PAYMENT_NOT_FOUND");
        }
        if (payment.getStatus() != PaymentStatus.PENDING) {
            return Result.conflict("PAYMENT_NOT_PENDING");
        }
        payment.markFailed(command.reason(), OffsetDateTime.now(clock));
        paymentRepository.save(payment);
        log.warn("Payment {} for booking {} failed: {}", payment.getId(), payment.getBookingId(), payment.getFailureReason());
        return Result.success(PaymentResponse.from(payment));
    }
}
