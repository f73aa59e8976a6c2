package com.medicaledu.backend.global.common.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class EmailTest {

    @Test
    @DisplayName("addresses are trimmed and lower-cased")
    void normalises() {
        Email email = Email.of("  Jane.Doe@Hospital.ORG ");

        assertThat(email.getValue()).isEqualTo("jane.doe@hospital.org");
        assertThat(email.getDomain()).isEqualTo("hospital.org");
        assertThat(email).isEqualTo(Email.of("jane.doe@hospital.org"));
    }

    @Test
    void rejectsMalformedAddresses() {
        assertThatThrownBy(() -> Email.of("no-at-sign.org")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Email.of("user@localhost")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Email.of("")).isInstanceOf(IllegalArgumentException.class);
        assertThat(Email.isValid("a@b.co")).isTrue();
        assertThat(Email.isValid(null)).isFalse();
    }

    @Test
    @DisplayName("addresses longer than 254 characters are rejected")
    void rejectsTooLong() {
        String local = "a".repeat(250);
        assertThatThrownBy(() -> Email.of(local + "@x.org")).isInstanceOf(IllegalArgumentException.class);
        assertThat(Email.isValid(local + "@x.org")).isFalse();
    }
}
