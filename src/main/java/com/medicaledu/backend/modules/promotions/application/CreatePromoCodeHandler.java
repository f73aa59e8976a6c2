package com.medicaledu.backend.modules.promotions.application;

import java.time.Clock;
import java.time.OffsetDateTime;

import com.medicaledu.backend.global.common.domain.Currency;
import com.medicaledu.backend.global.common.domain.PromoCodeValue;
import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.RequestHandler;
import com.medicaledu.backend.modules.promotions.domain.PromoCode;
import com.medicaledu.backend.modules.promotions.infrastructure.persistence.PromoCodeRepository;
import com.medicaledu.backend.modules.promotions.presentation.dto.PromoCodeResponse;

import org.springframework.stereotype.Service;

@Service
public class CreatePromoCodeHandler implements RequestHandler<CreatePromoCodeCommand, Result<PromoCodeResponse>> {

    static final int GENERATED_CODE_LENGTH = 8;
    private static final int MAX_GENERATION_ATTEMPTS = 5;

    private final PromoCodeRepository promoCodeRepository;
    private final Clock clock;

    public CreatePromoCodeHandler(PromoCodeRepository promoCodeRepository, Clock clock) {
        this.promoCodeRepository = promoCodeRepository;
        this.clock = clock;
    }

    @Override
    public Result<PromoCodeResponse> handle(CreatePromoCodeCommand command) {
        PromoCodeValue code;
        if (command.code() != null) {
            code = PromoCodeValue.of(command.code());
            if (promoCodeRepository.existsByCode(code)) {
                return Result.conflict("PROMO_CODE_ALREADY_EXISTS");
            }
        } else {
            code = generateUniqueCode();
            if (code == null) {
                return Result.failure("PROMO_CODE_GENERATION_FAILED");
            }
        }

        PromoCode promoCode = PromoCode.create(
                code,
                command.description(),
                command.discountType(),
                command.discountValue(),
                command.currency() != null ? Currency.of(command.currency()) : Currency.USD,
                command.maxUses(),
                command.validFrom(),
                command.validUntil(),
                command.applicableCourseIds(),
                OffsetDateTime.now(clock)
        );
        promoCodeRepository.save(promoCode);
        return Result.success(PromoCodeResponse.from(promoCode));
    }

    private PromoCodeValue generateUniqueCode() {
        for (int attempt = 0; attempt < MAX_GENERATION_ATTEMPTS; attempt++) {
            PromoCodeValue candidate = PromoCodeValue.generate(GENERATED_CODE_LENGTH);
            if (!promoCodeRepository.existsByCode(candidate)) {
                return candidate;
            }
        }
        return null;
    }
}
