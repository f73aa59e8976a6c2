package com.medicaledu.backend.global.common.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class UrlTest {

    @Test
    @DisplayName("a bare host is treated as https")
    void defaultsToHttps() {
        Url url = Url.of("meet.example.com/room-42");

        assertThat(url.getValue()).isEqualTo("https://meet.example.com/room-42");
        assertThat(url.isSecure()).isTrue();
    }

    @Test
    void acceptsHttpAndLocalhost() {
        assertThat(Url.of("http://localhost:8080/video").isSecure()).isFalse();
        assertThat(Url.isValid("https://cdn.example.org/a.mp4")).isTrue();
    }

    @Test
    @DisplayName("non-web schemes and hosts without a dot are rejected")
    void rejectsInvalid() {
        assertThatThrownBy(() -> Url.of("ftp://files.example.com")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Url.of("https://intranet")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Url.of("https://exa mple.com")).isInstanceOf(IllegalArgumentException.class);
        assertThat(Url.isValid("  ")).isFalse();
    }
}
