package com.medicaledu.backend.modules.promotions.domain;

public enum DiscountType {
    PERCENTAGE,
    FIXED_AMOUNT
}
