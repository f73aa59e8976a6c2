package com.medicaledu.backend.modules.promotions.application;

import java.time.Duration;

import com.medicaledu.backend.global.cache.CachePrefixes;
import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.CacheableQuery;
import com.medicaledu.backend.global.web.PageResponse;
import com.medicaledu.backend.modules.promotions.presentation.dto.PromoCodeResponse;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

public record GetPromoCodesQuery(Boolean active, @Min(0) int page, @Min(1) @Max(100) int size)
        implements CacheableQuery<Result<PageResponse<PromoCodeResponse>>> {

    @Override
    public String cachePrefix() {
        return CachePrefixes.GET_PROMO_CODES;
    }

    @Override
    public Duration cacheDuration() {
        return Duration.ofMinutes(10);
    }
}
