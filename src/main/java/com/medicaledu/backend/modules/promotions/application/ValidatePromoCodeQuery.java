package com.medicaledu.backend.modules.promotions.application;

import java.time.Duration;
import java.util.UUID;

import com.medicaledu.backend.global.cache.CachePrefixes;
import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.CacheableQuery;
import com.medicaledu.backend.modules.promotions.presentation.dto.PromoCodeValidationResponse;

import jakarta.validation.constraints.NotBlank;

/**
 * Checks whether a code can be used now, optionally for a specific course.
 */
public record ValidatePromoCodeQuery(@NotBlank String code, UUID courseId)
        implements CacheableQuery<Result<PromoCodeValidationResponse>> {

    @Override
    public String cachePrefix() {
        return CachePrefixes.GET_PROMO_CODES;
    }

    @Override
    public Duration cacheDuration() {
        return Duration.ofMinutes(1);
    }
}
