package com.medicaledu.backend.modules.payments.application;

import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.RequestHandler;
import com.medicaledu.backend.global.web.PageResponse;
import com.medicaledu.backend.modules.payments.infrastructure.persistence.PaymentRepository;
import com.medicaledu.backend.modules.payments.presentation.dto.PaymentResponse;

import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
public class GetPaymentsByUserHandler implements RequestHandler<GetPaymentsByUserQuery, Result<PageResponse<PaymentResponse>>> {

    private final PaymentRepository paymentRepository;

    public GetPaymentsByUserHandler(PaymentRepository paymentRepository) {
        this.paymentRepository = paymentRepository;
    }

    @Override
    public Result<PageResponse<PaymentResponse>> handle(GetPaymentsByUserQuery query) {
        PageRequest pageRequest = PageRequest.of(query.page(), query.size(), GetPaymentsHandler.NEWEST_FIRST);
        return Result.success(PageResponse.from(
                paymentRepository.findByUserId(query.userId(), pageRequest), PaymentResponse::from));
    }
}
