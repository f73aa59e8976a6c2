package com.medicaledu.backend.modules.payments.application;

import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.RequestHandler;
import com.medicaledu.backend.modules.payments.infrastructure.persistence.PaymentRepository;
import com.medicaledu.backend.modules.payments.presentation.dto.PaymentResponse;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
public class GetPaymentByIdHandler implements RequestHandler<GetPaymentByIdQuery, Result<PaymentResponse>> {

    private final PaymentRepository paymentRepository;

    public GetPaymentByIdHandler(PaymentRepository paymentRepository) {
        this.paymentRepository = paymentRepository;
    }

    @Override
    public Result<PaymentResponse> handle(GetPaymentByIdQuery query) {
        return paymentRepository.findById(query.paymentId())
                .map(PaymentResponse::from)
                .map(Result::success)
                .orElseGet(() -> Result.notFound("PAYMENT_NOT_FOUND"));
    }
}
