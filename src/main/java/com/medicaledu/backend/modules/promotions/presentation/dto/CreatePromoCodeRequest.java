package com.medicaledu.backend.modules.promotions.presentation.dto;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.medicaledu.backend.modules.promotions.domain.DiscountType;

/**
 * A missing {@code code} asks the server to generate one.
 */
public record CreatePromoCodeRequest(
        String code,
        String description,
        DiscountType discountType,
        BigDecimal discountValue,
        String currency,
        Integer maxUses,
        OffsetDateTime validFrom,
        OffsetDateTime validUntil,
        List<UUID> applicableCourseIds
) {
}
