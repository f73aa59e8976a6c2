package com.medicaledu.backend.modules.promotions.presentation.dto;

import java.math.BigDecimal;

import com.medicaledu.backend.modules.promotions.domain.DiscountType;

/**
 * Outcome of checking a code. {@code reason} is set when {@code valid} is false.
 */
public record PromoCodeValidationResponse(
        String code,
        boolean valid,
        String reason,
        DiscountType discountType,
        BigDecimal discountValue,
        String currency
) {
}
