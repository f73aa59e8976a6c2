package com.medicaledu.backend.modules.promotions.application;

import java.time.Clock;
import java.time.OffsetDateTime;

import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.RequestHandler;
import com.medicaledu.backend.modules.promotions.domain.PromoCode;
import com.medicaledu.backend.modules.promotions.infrastructure.persistence.PromoCodeRepository;
import com.medicaledu.backend.modules.promotions.presentation.dto.PromoCodeResponse;

import org.springframework.stereotype.Service;

@Service
public class DeactivatePromoCodeHandler implements RequestHandler<DeactivatePromoCodeCommand, Result<PromoCodeResponse>> {

    private final PromoCodeRepository promoCodeRepository;
    private final Clock clock;

    public DeactivatePromoCodeHandler(PromoCodeRepository promoCodeRepository, Clock clock) {
        this.promoCodeRepository = promoCodeRepository;
        this.clock = clock;
    }

    @Override
    public Result<PromoCodeResponse> handle(DeactivatePromoCodeCommand command) {
        PromoCode promoCode = promoCodeRepository.findById(command.promoCodeId()).orElse(null);
        if (promoCode == null) {
            return Result.notFound("PROMO_CODE_NOT_FOUND");
        }
        if (!promoCode.isActive()) {
            return Result.conflict("PROMO_CODE_ALREADY_INACTIVE");
        }
        promoCode.deactivate(OffsetDateTime.now(clock));
        promoCodeRepository.save(promoCode);
        return Result.success(PromoCodeResponse.from(promoCode));
    }
}
