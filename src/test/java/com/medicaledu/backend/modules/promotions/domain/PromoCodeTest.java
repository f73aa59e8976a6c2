package com.medicaledu.backend.modules.promotions.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.medicaledu.backend.global.common.domain.Currency;
import com.medicaledu.backend.global.common.domain.Money;
import com.medicaledu.backend.global.common.domain.PromoCodeValue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PromoCodeTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-03-01T09:00:00Z");

    @Test
    @DisplayName("percentage discounts are rounded to cents")
    void percentageDiscount() {
        PromoCode code = percentage("15", null, List.of());

        Money discount = code.calculateDiscount(Money.of(new BigDecimal("99.99"), Currency.EUR));

        assertThat(discount.getAmount()).isEqualByComparingTo("15.00");
        assertThat(discount.getCurrency()).isEqualTo(Currency.EUR);
    }

    @Test
    @DisplayName("a fixed discount never exceeds the price")
    void fixedDiscountIsCapped() {
        PromoCode code = PromoCode.create(PromoCodeValue.of("FLAT50"), null, DiscountType.FIXED_AMOUNT,
                new BigDecimal("50"), Currency.USD, null, NOW.minusDays(1), NOW.plusDays(1), null, NOW);

        assertThat(code.calculateDiscount(usd("30.00"))).isEqualTo(usd("30.00"));
        assertThat(code.calculateDiscount(usd("80.00"))).isEqualTo(usd("50.00"));
        assertThatThrownBy(() -> code.calculateDiscount(Money.of(BigDecimal.TEN, Currency.EUR)))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void validityWindowAndCourseScope() {
        UUID courseId = UUID.randomUUID();
        PromoCode code = percentage("10", null, List.of(courseId));

        assertThat(code.isApplicable(courseId, NOW)).isTrue();
        assertThat(code.isApplicable(UUID.randomUUID(), NOW)).isFalse();
        assertThat(code.isValidAt(NOW.plusDays(31))).isFalse();
        assertThat(code.isValidAt(NOW.minusDays(2))).isFalse();
    }

    @Test
    @DisplayName("redemption stops at the usage limit")
    void redeemRespectsMaxUses() {
        PromoCode code = percentage("10", 2, List.of());

        code.redeem(NOW);
        code.redeem(NOW);

        assertThat(code.getCurrentUses()).isEqualTo(2);
        assertThat(code.isUsageExhausted()).isTrue();
        assertThat(code.isValidAt(NOW)).isFalse();
        assertThatThrownBy(() -> code.redeem(NOW)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void creationGuards() {
        assertThatThrownBy(() -> percentage("101", null, List.of())).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> percentage("10", 0, List.of())).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PromoCode.create(PromoCodeValue.of("BADWINDOW"), null, DiscountType.PERCENTAGE,
                BigDecimal.TEN, null, null, NOW, NOW, null, NOW)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void deactivatedCodeCannotBeRedeemed() {
        PromoCode code = percentage("10", null, List.of());
        code.deactivate(NOW);

        assertThat(code.isValidAt(NOW)).isFalse();
        assertThatThrownBy(() -> code.redeem(NOW)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> code.deactivate(NOW)).isInstanceOf(IllegalStateException.class);
    }

    private static PromoCode percentage(String value, Integer maxUses, List<UUID> courseIds) {
        return PromoCode.create(PromoCodeValue.of("SPRING25"), "spring sale", DiscountType.PERCENTAGE,
                new BigDecimal(value), Currency.USD, maxUses, NOW.minusDays(1), NOW.plusDays(30), courseIds, NOW);
    }

    private static Money usd(String amount) {
        return Money.of(new BigDecimal(amount), Currency.USD);
    }
}
