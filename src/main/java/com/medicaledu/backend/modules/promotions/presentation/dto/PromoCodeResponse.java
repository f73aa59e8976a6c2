package com.medicaledu.backend.modules.promotions.presentation.dto;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.medicaledu.backend.modules.promotions.domain.DiscountType;
import com.medicaledu.backend.modules.promotions.domain.PromoCode;

public record PromoCodeResponse(
        UUID id,
        String code,
        String description,
        DiscountType discountType,
        BigDecimal discountValue,
        String currency,
        Integer maxUses,
        int currentUses,
        OffsetDateTime validFrom,
        OffsetDateTime validUntil,
        boolean active,
        List<UUID> applicableCourseIds,
        OffsetDateTime createdAt
) {

    public static PromoCodeResponse from(PromoCode promoCode) {
        return new PromoCodeResponse(
                promoCode.getId(),
                promoCode.getCode().getValue(),
                promoCode.getDescription(),
                promoCode.getDiscountType(),
                promoCode.getDiscountValue(),
                promoCode.getCurrency().getCode(),
                promoCode.getMaxUses(),
                promoCode.getCurrentUses(),
                promoCode.getValidFrom(),
                promoCode.getValidUntil(),
                promoCode.isActive(),
                promoCode.getApplicableCourseIds(),
                promoCode.getCreatedAt()
        );
    }
}
