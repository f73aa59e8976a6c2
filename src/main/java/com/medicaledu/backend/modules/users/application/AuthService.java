package com.medicaledu.backend.modules.users.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

import com.medicaledu.backend.global.common.domain.Email;
import com.medicaledu.backend.global.error.ProblemException;
import com.medicaledu.backend.modules.users.domain.User;
import com.medicaledu.backend.modules.users.domain.UserSession;
import com.medicaledu.backend.modules.users.infrastructure.persistence.UserRepository;
import com.medicaledu.backend.modules.users.infrastructure.persistence.UserSessionRepository;
import com.medicaledu.backend.modules.users.presentation.dto.LoginRequest;
import com.medicaledu.backend.modules.users.presentation.dto.LoginResponse;
import com.medicaledu.backend.modules.users.presentation.dto.LogoutRequest;
import com.medicaledu.backend.modules.users.presentation.dto.PasswordResetConfirmRequest;
import com.medicaledu.backend.modules.users.presentation.dto.RefreshRequest;
import com.medicaledu.backend.modules.users.presentation.dto.TokenPairResponse;
import com.medicaledu.backend.modules.users.presentation.dto.UserResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

/**
 * Session management: login with lockout, refresh-token rotation, logout and password reset.
 * Rejections are thrown as status exceptions without rolling back, so failed-attempt counters persist.
 */
@Service
@Transactional(noRollbackFor = ResponseStatusException.class)
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private static final String REASON_EXPIRED = "EXPIRED";
    private static final String REASON_ROTATED = "ROTATED";
    private static final String REASON_LOGOUT = "LOGOUT";
    private static final String REASON_DEVICE_MISMATCH = "DEVICE_MISMATCH";
    private static final String REASON_USER_INACTIVE = "USER_INACTIVE";
    private static final String REASON_PASSWORD_RESET = "PASSWORD_RESET";
    private static final int DEVICE_ID_MAX_LENGTH = 100;
    static final Duration PASSWORD_RESET_TOKEN_TTL = Duration.ofHours(1);

    private final UserRepository userRepository;
    private final UserSessionRepository userSessionRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenService jwtTokenService;
    private final Clock clock;
    private final int maxFailedAttempts;
    private final Duration lockoutDuration;

    public AuthService(
            UserRepository userRepository,
            UserSessionRepository userSessionRepository,
            PasswordEncoder passwordEncoder,
            JwtTokenService jwtTokenService,
            Clock clock,
            @Value("${app.auth.max-failed-attempts:5}") int maxFailedAttempts,
            @Value("${app.auth.lockout-duration:PT15M}") Duration lockoutDuration
    ) {
        this.userRepository = userRepository;
        this.userSessionRepository = userSessionRepository;
        this.passwordEncoder = passwordEncoder;
        this.jwtTokenService = jwtTokenService;
        this.clock = clock;
        this.maxFailedAttempts = maxFailedAttempts;
        this.lockoutDuration = lockoutDuration;
    }

    public LoginResponse login(LoginRequest request) {
        User user = findByEmail(request.email())
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.UNAUTHORIZED, "INVALID_CREDENTIALS"));
        OffsetDateTime now = OffsetDateTime.now(clock);

        if (!user.isActive()) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "USER_INACTIVE");
        }
        if (user.isLocked(now)) {
            throw new ResponseStatusException(HttpStatus.LOCKED, "ACCOUNT_LOCKED");
        }

        if (!passwordEncoder.matches(request.password(), user.getPasswordHash())) {
            boolean locked = user.recordFailedLogin(maxFailedAttempts, lockoutDuration, now);
            userRepository.save(user);
            if (locked) {
                log.warn("User {} locked until {} after repeated failed logins", user.getId(), user.getLockedUntil());
                throw new ResponseStatusException(HttpStatus.LOCKED, "ACCOUNT_LOCKED");
            }
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "INVALID_CREDENTIALS");
        }

        user.recordSuccessfulLogin(now);
        userRepository.save(user);
        userSessionRepository.revokeExpiredSessions(user.getId(), now, REASON_EXPIRED);

        TokenPairResponse tokens = openSession(user, normalizeDeviceId(request.deviceId()));
        return new LoginResponse(tokens, UserResponse.from(user));
    }

    public LoginResponse refresh(RefreshRequest request) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        UserSession session = userSessionRepository.findByRefreshToken(request.refreshToken())
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.UNAUTHORIZED, "INVALID_REFRESH_TOKEN"));

        if (session.isRevoked()) {
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "INVALID_REFRESH_TOKEN");
        }
        if (session.isExpired(now)) {
            session.revoke(REASON_EXPIRED, now);
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "REFRESH_TOKEN_EXPIRED");
        }

        String requestDeviceId = normalizeDeviceId(request.deviceId());
        String sessionDeviceId = normalizeDeviceId(session.getDeviceId());
        if (sessionDeviceId != null && requestDeviceId != null && !Objects.equals(sessionDeviceId, requestDeviceId)) {
            session.revoke(REASON_DEVICE_MISMATCH, now);
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "REFRESH_TOKEN_DEVICE_MISMATCH");
        }

        User user = session.getUser();
        if (!user.isActive()) {
            session.revoke(REASON_USER_INACTIVE, now);
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "USER_INACTIVE");
        }

        // single use: the presented token dies with this call
        session.refreshActivity(now);
        session.revoke(REASON_ROTATED, now);
        userSessionRepository.revokeExpiredSessions(user.getId(), now, REASON_EXPIRED);

        TokenPairResponse tokens = openSession(user, requestDeviceId != null ? requestDeviceId : sessionDeviceId);
        return new LoginResponse(tokens, UserResponse.from(user));
    }

    public void logout(LogoutRequest request) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        // unknown tokens get the same response so token validity is not disclosed
        userSessionRepository.findByRefreshToken(request.refreshToken())
                .filter(session -> !session.isRevoked())
                .ifPresent(session -> {
                    session.revoke(REASON_LOGOUT, now);
                    User user = session.getUser();
                    user.recordLogout(now);
                    userRepository.save(user);
                });
    }

    public void requestPasswordReset(String rawEmail) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        findByEmail(rawEmail)
                .filter(User::isActive)
                .ifPresentOrElse(user -> {
                    user.issuePasswordReset(newOpaqueToken(), now.plus(PASSWORD_RESET_TOKEN_TTL), now);
                    userRepository.save(user);
                    log.info("Password reset token issued for user {}", user.getId());
                }, () -> log.debug("Password reset requested for unknown or inactive account"));
    }

    public void confirmPasswordReset(PasswordResetConfirmRequest request) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        User user = findByEmail(request.email())
                .orElseThrow(() -> new ProblemException(HttpStatus.BAD_REQUEST, "INVALID_RESET_TOKEN"));
        if (user.getPasswordResetToken() == null
                || !user.getPasswordResetToken().equals(request.token())
                || (user.getPasswordResetTokenExpiresAt() != null && user.getPasswordResetTokenExpiresAt().isBefore(now))) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "INVALID_RESET_TOKEN");
        }
        user.verifyAndConsumePasswordResetToken(request.token(), now);
        user.updatePassword(passwordEncoder.encode(request.newPassword()), now);
        userRepository.save(user);
        userSessionRepository.revokeAllActiveSessions(user.getId(), now, REASON_PASSWORD_RESET);
    }

    private TokenPairResponse openSession(User user, String deviceId) {
        String refreshToken = newOpaqueToken();
        TokenPairResponse tokens = jwtTokenService.issueTokenPair(
                user.getId(), user.getEmail().getValue(), List.of(user.getRole().name()), refreshToken);
        OffsetDateTime issuedAt = tokens.issuedAt();
        userSessionRepository.save(UserSession.open(
                user, refreshToken, issuedAt, issuedAt.plusSeconds(tokens.refreshExpiresIn()), deviceId));
        return tokens;
    }

    private Optional<User> findByEmail(String rawEmail) {
        if (!Email.isValid(rawEmail)) {
            return Optional.empty();
        }
        return userRepository.findByEmail(Email.of(rawEmail));
    }

    static String newOpaqueToken() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    private String normalizeDeviceId(String rawDeviceId) {
        if (rawDeviceId == null) {
            return null;
        }
        String trimmed = rawDeviceId.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        if (trimmed.length() > DEVICE_ID_MAX_LENGTH) {
            return trimmed.substring(0, DEVICE_ID_MAX_LENGTH);
        }
        return trimmed;
    }
}
