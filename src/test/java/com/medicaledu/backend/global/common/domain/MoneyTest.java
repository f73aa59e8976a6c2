package com.medicaledu.backend.global.common.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class MoneyTest {

    @Test
    @DisplayName("amounts are scaled to two decimals with banker's rounding")
    void scalesToTwoDecimals() {
        assertThat(Money.of(new BigDecimal("10.005"), Currency.USD).getAmount()).isEqualByComparingTo("10.00");
        assertThat(Money.of(new BigDecimal("10.015"), Currency.USD).getAmount()).isEqualByComparingTo("10.02");
        assertThat(Money.of(new BigDecimal("7"), "usd").getAmount().scale()).isEqualTo(2);
    }

    @Test
    @DisplayName("negative amounts and missing currency are rejected")
    void rejectsInvalidInput() {
        assertThatThrownBy(() -> Money.of(new BigDecimal("-0.01"), Currency.USD))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Money.of(BigDecimal.ONE, (Currency) null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Money.of(null, Currency.USD))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("arithmetic requires matching currencies")
    void arithmeticRequiresSameCurrency() {
        Money usd = Money.of(new BigDecimal("10"), Currency.USD);
        Money eur = Money.of(new BigDecimal("10"), Currency.EUR);

        assertThatThrownBy(() -> usd.add(eur)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> usd.isGreaterThan(eur)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("subtraction below zero fails")
    void subtractionCannotGoNegative() {
        Money ten = Money.of(new BigDecimal("10"), Currency.USD);
        Money eleven = Money.of(new BigDecimal("11"), Currency.USD);

        assertThat(eleven.subtract(ten)).isEqualTo(Money.of(BigDecimal.ONE, Currency.USD));
        assertThatThrownBy(() -> ten.subtract(eleven)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void multiplyAndMin() {
        Money price = Money.of(new BigDecimal("80.00"), Currency.USD);

        Money discounted = price.multiply(new BigDecimal("0.25"));

        assertThat(discounted.getAmount()).isEqualByComparingTo("20.00");
        assertThat(price.min(discounted)).isSameAs(discounted);
        assertThatThrownBy(() -> price.multiply(new BigDecimal("-1"))).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("equality ignores trailing zeros")
    void equalityIgnoresScale() {
        Money a = Money.of(new BigDecimal("5"), Currency.EUR);
        Money b = Money.of(new BigDecimal("5.00"), Currency.EUR);

        assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
        assertThat(a).isNotEqualTo(Money.of(new BigDecimal("5"), Currency.USD));
        assertThat(a.toString()).isEqualTo("5.00 EUR");
    }

    @Test
    @DisplayName("currency codes are normalised to upper case")
    void currencyNormalisation() {
        assertThat(Currency.of(" eur ")).isEqualTo(Currency.EUR);
        assertThatThrownBy(() -> Currency.of("EURO")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Currency.of("E1R")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Currency.of(" ")).isInstanceOf(IllegalArgumentException.class);
    }
}
