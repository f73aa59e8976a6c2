package com.medicaledu.backend.global.common.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PromoCodeValueTest {

    @Test
    @DisplayName("whitespace is stripped and letters upper-cased")
    void normalises() {
        assertThat(PromoCodeValue.of(" spring 25 ").getValue()).isEqualTo("SPRING25");
        assertThat(PromoCodeValue.isValid("spring25")).isTrue();
    }

    @Test
    void enforcesLengthAndAlphabet() {
        assertThatThrownBy(() -> PromoCodeValue.of("AB1")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PromoCodeValue.of("A".repeat(21))).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PromoCodeValue.of("SAVE-10")).isInstanceOf(IllegalArgumentException.class);
        assertThat(PromoCodeValue.isValid(null)).isFalse();
    }

    @Test
    @DisplayName("generated codes satisfy the format")
    void generatedCodesAreValid() {
        PromoCodeValue generated = PromoCodeValue.generate(8);

        assertThat(generated.getValue()).hasSize(8).matches("[A-Z0-9]+");
        assertThatThrownBy(() -> PromoCodeValue.generate(3)).isInstanceOf(IllegalArgumentException.class);
    }
}
