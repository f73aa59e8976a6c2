package com.medicaledu.backend.modules.promotions.application;

import java.util.UUID;

import com.medicaledu.backend.global.cache.CacheInvalidation;
import com.medicaledu.backend.global.cache.CachePrefixes;
import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.Command;
import com.medicaledu.backend.modules.promotions.presentation.dto.PromoCodeResponse;

import jakarta.validation.constraints.NotNull;

@CacheInvalidation(prefixes = CachePrefixes.GET_PROMO_CODES)
public record DeactivatePromoCodeCommand(@NotNull UUID promoCodeId) implements Command<Result<PromoCodeResponse>> {
}
