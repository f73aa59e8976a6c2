package com.medicaledu.backend.modules.payments.application;

import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.RequestHandler;
import com.medicaledu.backend.global.web.PageResponse;
import com.medicaledu.backend.modules.payments.infrastructure.persistence.PaymentRepository;
import com.medicaledu.backend.modules.payments.presentation.dto.PaymentResponse;

import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
public class GetPaymentsHandler implements RequestHandler<GetPaymentsQuery, Result<PageResponse<PaymentResponse>>> {

    static final Sort NEWEST_FIRST = Sort.by(Sort.Direction.DESC, "createdAt");

    private final PaymentRepository paymentRepository;

    public GetPaymentsHandler(PaymentRepository paymentRepository) {
        this.paymentRepository = paymentRepository;
    }

    @Override
    public Result<PageResponse<PaymentResponse>> handle(GetPaymentsQuery query) {
        PageRequest pageRequest = PageRequest.of(query.page(), query.size(), NEWEST_FIRST);
        return Result.success(PageResponse.from(paymentRepository.search(query.status(), pageRequest), PaymentResponse::from));
    }
}
