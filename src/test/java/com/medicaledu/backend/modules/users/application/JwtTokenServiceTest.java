package com.medicaledu.backend.modules.users.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import com.medicaledu.backend.modules.users.presentation.dto.TokenPairResponse;

import org.junit.jupiter.api.Test;

class JwtTokenServiceTest {

    private static final String SECRET = "unit-test-secret-that-is-long-enough-for-hs256";
    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");

    private final JwtTokenService service = service(Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void issuedAccessTokenParsesBack() {
        UUID userId = UUID.randomUUID();

        TokenPairResponse pair = service.issueTokenPair(userId, "ada@example.com", List.of("INSTRUCTOR"), "refresh");
        JwtTokenService.ParsedToken parsed = service.parseAccessToken(pair.accessToken());

        assertThat(pair.tokenType()).isEqualTo("Bearer");
        assertThat(pair.expiresIn()).isEqualTo(900L);
        assertThat(pair.refreshToken()).isEqualTo("refresh");
        assertThat(parsed.userId()).isEqualTo(userId);
        assertThat(parsed.email()).isEqualTo("ada@example.com");
        assertThat(parsed.roles()).containsExactly("INSTRUCTOR");
        assertThat(parsed.expiresAt()).isEqualTo(OffsetDateTime.ofInstant(NOW.plusSeconds(900), ZoneOffset.UTC));
    }

    @Test
    void expiredTokenIsRejected() {
        String token = service.issueTokenPair(UUID.randomUUID(), "a@example.com", List.of("STUDENT"), "r")
                .accessToken();
        JwtTokenService later = service(Clock.fixed(NOW.plusSeconds(3600), ZoneOffset.UTC));

        assertThatThrownBy(() -> later.parseAccessToken(token))
                .isInstanceOf(JwtTokenService.InvalidTokenException.class);
    }

    @Test
    void tokenSignedWithAnotherKeyIsRejected() {
        JwtTokenService other = new JwtTokenService("another-secret-that-is-also-long-enough-for-hs256",
                900_000L, 604_800_000L, Clock.fixed(NOW, ZoneOffset.UTC));
        String token = other.issueTokenPair(UUID.randomUUID(), "a@example.com", List.of(), "r").accessToken();

        assertThatThrownBy(() -> service.parseAccessToken(token))
                .isInstanceOf(JwtTokenService.InvalidTokenException.class);
        assertThatThrownBy(() -> service.parseAccessToken("not-a-jwt"))
                .isInstanceOf(JwtTokenService.InvalidTokenException.class);
    }

    private static JwtTokenService service(Clock clock) {
        return new JwtTokenService(SECRET, 900_000L, 604_800_000L, clock);
    }
}
