package com.medicaledu.backend.modules.payments.application;

import java.time.Clock;
import java.time.OffsetDateTime;

import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.RequestHandler;
import com.medicaledu.backend.modules.payments.domain.Payment;
import com.medicaledu.backend.modules.payments.domain.PaymentStatus;
import com.medicaledu.backend.modules.payments.infrastructure.persistence.PaymentRepository;
import com.medicaledu.backend.modules.payments.presentation.dto.PaymentResponse;

import org.springframework.stereotype.Service;

@Service
public class CancelPaymentHandler implements RequestHandler<CancelPaymentCommand, Result<PaymentResponse>> {

    private final PaymentRepository paymentRepository;
    private final Clock clock;

    public CancelPaymentHandler(PaymentRepository paymentRepository, Clock clock) {
        this.paymentRepository = paymentRepository;
        this.clock = clock;
    }

    @Override
    public Result<PaymentResponse> handle(CancelPaymentCommand command) {
        Payment payment = paymentRepository.findByIdForUpdate(command.paymentId()).orElse(null);
        if (payment == null) {
            return Result.notFound("PAYMENT_NOT_FOUND");
        }
        if (payment.getStatus() != PaymentStatus.PENDING && payment.getStatus() != PaymentStatus.SUCCEEDED) {
            return Result.conflict("PAYMENT_NOT_CANCELLABLE");
        }
        payment.cancel(OffsetDateTime.now(clock));
        paymentRepository.save(payment);
        return Result.success(PaymentResponse.from(payment));
    }
}
