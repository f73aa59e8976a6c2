package com.medicaledu.backend.modules.promotions.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;

import com.medicaledu.backend.global.common.domain.PromoCodeValue;
import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.RequestHandler;
import com.medicaledu.backend.modules.promotions.domain.PromoCode;
import com.medicaledu.backend.modules.promotions.infrastructure.persistence.PromoCodeRepository;
import com.medicaledu.backend.modules.promotions.presentation.dto.PromoCodeValidationResponse;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
public class ValidatePromoCodeHandler implements RequestHandler<ValidatePromoCodeQuery, Result<PromoCodeValidationResponse>> {

    private final PromoCodeRepository promoCodeRepository;
    private final Clock clock;

    public ValidatePromoCodeHandler(PromoCodeRepository promoCodeRepository, Clock clock) {
        this.promoCodeRepository = promoCodeRepository;
        this.clock = clock;
    }

    @Override
    public Result<PromoCodeValidationResponse> handle(ValidatePromoCodeQuery query) {
        if (!PromoCodeValue.isValid(query.code())) {
            return Result.validationFailure(List.of("code: must be 4-20 letters or digits"));
        }
        PromoCode promoCode = promoCodeRepository.findByCode(PromoCodeValue.of(query.code())).orElse(null);
        if (promoCode == null) {
            return Result.notFound("PROMO_CODE_NOT_FOUND");
        }
        String reason = PromoCodeService.rejectionReason(promoCode, query.courseId(), OffsetDateTime.now(clock));
        return Result.success(new PromoCodeValidationResponse(
                promoCode.getCode().getValue(),
                reason == null,
                reason,
                promoCode.getDiscountType(),
                promoCode.getDiscountValue(),
                promoCode.getCurrency().getCode()
        ));
    }
}
