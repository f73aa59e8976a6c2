package com.medicaledu.backend.modules.promotions.application;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.medicaledu.backend.global.cache.CacheInvalidation;
import com.medicaledu.backend.global.cache.CachePrefixes;
import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.Command;
import com.medicaledu.backend.modules.promotions.domain.DiscountType;
import com.medicaledu.backend.modules.promotions.presentation.dto.PromoCodeResponse;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

@CacheInvalidation(prefixes = CachePrefixes.GET_PROMO_CODES)
public record CreatePromoCodeCommand(
        String code,
        @Size(max = 500) String description,
        @NotNull DiscountType discountType,
        @NotNull @DecimalMin("0.00") BigDecimal discountValue,
        @Size(min = 3, max = 3) String currency,
        @Positive Integer maxUses,
        @NotNull OffsetDateTime validFrom,
        @NotNull OffsetDateTime validUntil,
        List<@NotNull UUID> applicableCourseIds
) implements Command<Result<PromoCodeResponse>> {
}
