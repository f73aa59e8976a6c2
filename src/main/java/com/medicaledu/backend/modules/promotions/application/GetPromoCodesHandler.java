package com.medicaledu.backend.modules.promotions.application;

import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.RequestHandler;
import com.medicaledu.backend.global.web.PageResponse;
import com.medicaledu.backend.modules.promotions.domain.PromoCode;
import com.medicaledu.backend.modules.promotions.infrastructure.persistence.PromoCodeRepository;
import com.medicaledu.backend.modules.promotions.presentation.dto.PromoCodeResponse;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
public class GetPromoCodesHandler implements RequestHandler<GetPromoCodesQuery, Result<PageResponse<PromoCodeResponse>>> {

    private final PromoCodeRepository promoCodeRepository;

    public GetPromoCodesHandler(PromoCodeRepository promoCodeRepository) {
        this.promoCodeRepository = promoCodeRepository;
    }

    @Override
    public Result<PageResponse<PromoCodeResponse>> handle(GetPromoCodesQuery query) {
        PageRequest pageRequest = PageRequest.of(query.page(), query.size(), Sort.by(Sort.Direction.DESC, "createdAt"));
        Page<PromoCode> page = query.active() == null
                ? promoCodeRepository.findAll(pageRequest)
                : promoCodeRepository.findByActive(query.active(), pageRequest);
        return Result.success(PageResponse.from(page, PromoCodeResponse::from));
    }
}
