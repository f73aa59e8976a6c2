package com.medicaledu.backend.modules.users.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import com.medicaledu.backend.global.common.domain.Email;
import com.medicaledu.backend.global.error.ProblemException;
import com.medicaledu.backend.modules.users.domain.User;
import com.medicaledu.backend.modules.users.domain.UserRole;
import com.medicaledu.backend.modules.users.domain.UserSession;
import com.medicaledu.backend.modules.users.infrastructure.persistence.UserRepository;
import com.medicaledu.backend.modules.users.infrastructure.persistence.UserSessionRepository;
import com.medicaledu.backend.modules.users.presentation.dto.LoginRequest;
import com.medicaledu.backend.modules.users.presentation.dto.LoginResponse;
import com.medicaledu.backend.modules.users.presentation.dto.PasswordResetConfirmRequest;
import com.medicaledu.backend.modules.users.presentation.dto.RefreshRequest;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.annotation.AnnotationUtils;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

@ExtendWith(MockitoExtension.class)
class AuthServiceTest {

    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");
    private static final OffsetDateTime NOW_UTC = OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC);
    private static final int MAX_FAILED_ATTEMPTS = 3;
    private static final Duration LOCKOUT = Duration.ofMinutes(15);

    @Mock
    private UserRepository userRepository;

    @Mock
    private UserSessionRepository userSessionRepository;

    @Mock
    private PasswordEncoder passwordEncoder;

    private AuthService authService;
    private User user;

    @BeforeEach
    void setUp() {
        authService = service(Clock.fixed(NOW, ZoneOffset.UTC));
        user = User.register("Ada", Email.of("ada@example.com"), "{bcrypt}hash", UserRole.STUDENT, null, null, NOW_UTC);
    }

    @Test
    void loginOpensSessionForTrimmedDevice() {
        when(userRepository.findByEmail(any(Email.class))).thenReturn(Optional.of(user));
        when(passwordEncoder.matches("secret-pass", "{bcrypt}hash")).thenReturn(true);

        LoginResponse response = authService.login(new LoginRequest("ada@example.com", "secret-pass", "  ios-device  "));

        ArgumentCaptor<UserSession> session = ArgumentCaptor.forClass(UserSession.class);
        verify(userSessionRepository).save(session.capture());
        assertThat(session.getValue().getDeviceId()).isEqualTo("ios-device");
        assertThat(session.getValue().getRefreshToken()).isEqualTo(response.tokens().refreshToken());
        assertThat(response.user().id()).isEqualTo(user.getId());
        assertThat(user.getLastLoginAt()).isEqualTo(NOW_UTC);
        verify(userSessionRepository).revokeExpiredSessions(user.getId(), NOW_UTC, "EXPIRED");
    }

    @Test
    @DisplayName("the last allowed failed attempt locks the account and the lock is saved before the rejection")
    void repeatedFailuresLockAccount() {
        when(userRepository.findByEmail(any(Email.class))).thenReturn(Optional.of(user));
        when(passwordEncoder.matches(anyString(), anyString())).thenReturn(false);
        LoginRequest wrong = new LoginRequest("ada@example.com", "wrong-pass", null);

        for (int attempt = 1; attempt < MAX_FAILED_ATTEMPTS; attempt++) {
            ResponseStatusException rejected = assertThrows(ResponseStatusException.class, () -> authService.login(wrong));
            assertThat(rejected.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
            assertThat(rejected.getReason()).isEqualTo("INVALID_CREDENTIALS");
        }
        ResponseStatusException locked = assertThrows(ResponseStatusException.class, () -> authService.login(wrong));

        assertThat(locked.getStatusCode()).isEqualTo(HttpStatus.LOCKED);
        assertThat(locked.getReason()).isEqualTo("ACCOUNT_LOCKED");
        assertThat(user.getLockedUntil()).isEqualTo(NOW_UTC.plus(LOCKOUT));
        verify(userRepository, times(MAX_FAILED_ATTEMPTS)).save(user);
        verify(userSessionRepository, never()).save(any());
    }

    @Test
    void rejectedLoginsDoNotRollBackTheFailureCounter() {
        Transactional transactional = AnnotationUtils.findAnnotation(AuthService.class, Transactional.class);

        assertThat(transactional).isNotNull();
        assertThat(transactional.noRollbackFor()).contains(ResponseStatusException.class);
    }

    @Test
    void lockedAccountIsRejectedUntilLockExpires() {
        user.lock(NOW_UTC.plus(LOCKOUT), NOW_UTC);
        when(userRepository.findByEmail(any(Email.class))).thenReturn(Optional.of(user));

        ResponseStatusException locked = assertThrows(ResponseStatusException.class,
                () -> authService.login(new LoginRequest("ada@example.com", "secret-pass", null)));
        assertThat(locked.getStatusCode()).isEqualTo(HttpStatus.LOCKED);
        verifyNoInteractions(passwordEncoder);

        when(passwordEncoder.matches("secret-pass", "{bcrypt}hash")).thenReturn(true);
        AuthService later = service(Clock.fixed(NOW.plus(LOCKOUT).plusSeconds(60), ZoneOffset.UTC));

        LoginResponse response = later.login(new LoginRequest("ada@example.com", "secret-pass", null));

        assertThat(response.tokens().accessToken()).isNotBlank();
        assertThat(user.getLockedUntil()).isNull();
    }

    @Test
    void refreshTokenIsSingleUse() {
        UserSession session = UserSession.open(user, "old-token", NOW_UTC.minusMinutes(5), NOW_UTC.plusDays(7), "web");
        when(userSessionRepository.findByRefreshToken("old-token")).thenReturn(Optional.of(session));

        LoginResponse rotated = authService.refresh(new RefreshRequest("old-token", "web"));

        assertThat(rotated.tokens().refreshToken()).isNotEqualTo("old-token");
        assertThat(session.isRevoked()).isTrue();
        assertThat(session.getRevokedReason()).isEqualTo("ROTATED");
        ArgumentCaptor<UserSession> replacement = ArgumentCaptor.forClass(UserSession.class);
        verify(userSessionRepository).save(replacement.capture());
        assertThat(replacement.getValue().getDeviceId()).isEqualTo("web");

        ResponseStatusException reused = assertThrows(ResponseStatusException.class,
                () -> authService.refresh(new RefreshRequest("old-token", "web")));
        assertThat(reused.getReason()).isEqualTo("INVALID_REFRESH_TOKEN");
    }

    @Test
    void refreshFromAnotherDeviceRevokesSession() {
        UserSession session = UserSession.open(user, "web-token", NOW_UTC.minusMinutes(5), NOW_UTC.plusDays(7), "web");
        when(userSessionRepository.findByRefreshToken("web-token")).thenReturn(Optional.of(session));

        ResponseStatusException exception = assertThrows(ResponseStatusException.class,
                () -> authService.refresh(new RefreshRequest("web-token", "mobile-app")));

        assertThat(exception.getReason()).isEqualTo("REFRESH_TOKEN_DEVICE_MISMATCH");
        assertThat(session.getRevokedReason()).isEqualTo("DEVICE_MISMATCH");
        verify(userSessionRepository, never()).save(any());
    }

    @Test
    void expiredRefreshTokenIsRevoked() {
        UserSession session = UserSession.open(user, "stale", NOW_UTC.minusDays(8), NOW_UTC.minusDays(1), null);
        when(userSessionRepository.findByRefreshToken("stale")).thenReturn(Optional.of(session));

        ResponseStatusException exception = assertThrows(ResponseStatusException.class,
                () -> authService.refresh(new RefreshRequest("stale", null)));

        assertThat(exception.getReason()).isEqualTo("REFRESH_TOKEN_EXPIRED");
        assertThat(session.getRevokedReason()).isEqualTo("EXPIRED");
    }

    @Test
    void resetRequestForUnknownEmailRevealsNothing() {
        when(userRepository.findByEmail(any(Email.class))).thenReturn(Optional.empty());

        authService.requestPasswordReset("nobody@example.com");
        authService.requestPasswordReset("not-an-email");

        verify(userRepository, times(1)).findByEmail(any(Email.class));
        verify(userRepository, never()).save(any());
    }

    @Test
    void resetRequestIssuesTokenValidForOneHour() {
        when(userRepository.findByEmail(any(Email.class))).thenReturn(Optional.of(user));

        authService.requestPasswordReset("ada@example.com");

        assertThat(user.getPasswordResetToken()).isNotBlank();
        assertThat(user.getPasswordResetTokenExpiresAt()).isEqualTo(NOW_UTC.plusHours(1));
        verify(userRepository).save(user);
    }

    @Test
    void wrongResetTokenIsRejected() {
        user.issuePasswordReset("right-token", NOW_UTC.plusHours(1), NOW_UTC);
        when(userRepository.findByEmail(any(Email.class))).thenReturn(Optional.of(user));

        ProblemException exception = assertThrows(ProblemException.class, () -> authService.confirmPasswordReset(
                new PasswordResetConfirmRequest("ada@example.com", "wrong-token", "new-password-1")));

        assertThat(exception.getCode()).isEqualTo("INVALID_RESET_TOKEN");
        assertThat(user.getPasswordResetToken()).isEqualTo("right-token");
        verify(userRepository, never()).save(any());
    }

    @Test
    void expiredResetTokenIsRejected() {
        user.issuePasswordReset("right-token", NOW_UTC.minusMinutes(1), NOW_UTC.minusHours(1));
        when(userRepository.findByEmail(any(Email.class))).thenReturn(Optional.of(user));

        ProblemException exception = assertThrows(ProblemException.class, () -> authService.confirmPasswordReset(
                new PasswordResetConfirmRequest("ada@example.com", "right-token", "new-password-1")));

        assertThat(exception.getCode()).isEqualTo("INVALID_RESET_TOKEN");
    }

    @Test
    void validResetTokenChangesPasswordAndEndsSessions() {
        user.issuePasswordReset("right-token", NOW_UTC.plusHours(1), NOW_UTC);
        when(userRepository.findByEmail(any(Email.class))).thenReturn(Optional.of(user));
        when(passwordEncoder.encode("new-password-1")).thenReturn("{bcrypt}new");

        authService.confirmPasswordReset(new PasswordResetConfirmRequest("ada@example.com", "right-token", "new-password-1"));

        assertThat(user.getPasswordHash()).isEqualTo("{bcrypt}new");
        assertThat(user.getPasswordResetToken()).isNull();
        verify(userSessionRepository).revokeAllActiveSessions(eq(user.getId()), eq(NOW_UTC), eq("PASSWORD_RESET"));
    }

    private AuthService service(Clock clock) {
        JwtTokenService jwtTokenService = new JwtTokenService(
                "unit-test-secret-that-is-long-enough-for-hs256", 900_000L, 604_800_000L, clock);
        return new AuthService(userRepository, userSessionRepository, passwordEncoder, jwtTokenService, clock,
                MAX_FAILED_ATTEMPTS, LOCKOUT);
    }
}
