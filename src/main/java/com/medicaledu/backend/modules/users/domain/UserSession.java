package com.medicaledu.backend.modules.users.domain;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.medicaledu.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * Refresh-token session. Refresh tokens are single use: a refresh revokes the session and
 * opens a new one.
 */
@Entity
@Table(name = "user_session")
public class UserSession extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id", nullable = false)
    private User user;

    @Column(name = "refresh_token", nullable = false, unique = true, length = 255)
    private String refreshToken;

    @Column(name = "issued_at", nullable = false)
    private OffsetDateTime issuedAt;

    @Column(name = "expires_at", nullable = false)
    private OffsetDateTime expiresAt;

    @Column(name = "revoked_at")
    private OffsetDateTime revokedAt;

    @Column(name = "revoked_reason", length = 100)
    private String revokedReason;

    @Column(name = "device_id", length = 100)
    private String deviceId;

    @Column(name = "last_activity_at")
    private OffsetDateTime lastActivityAt;

    protected UserSession() {
    }

    public static UserSession open(User user, String refreshToken, OffsetDateTime issuedAt, OffsetDateTime expiresAt, String deviceId) {
        if (refreshToken == null || refreshToken.isBlank()) {
            throw new IllegalArgumentException("Refresh token is required.");
        }
        if (!expiresAt.isAfter(issuedAt)) {
            throw new IllegalArgumentException("Session must expire after it is issued.");
        }
        UserSession session = new UserSession();
        session.user = user;
        session.refreshToken = refreshToken;
        session.issuedAt = issuedAt;
        session.expiresAt = expiresAt;
        session.deviceId = deviceId;
        session.lastActivityAt = issuedAt;
        return session;
    }

    public void refreshActivity(OffsetDateTime now) {
        this.lastActivityAt = now;
    }

    public boolean isExpired(OffsetDateTime now) {
        return !expiresAt.isAfter(now);
    }

    public boolean isRevoked() {
        return revokedAt != null;
    }

    public boolean isActive(OffsetDateTime now) {
        return !isRevoked() && !isExpired(now);
    }

    public void extend(Duration duration) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            throw new IllegalArgumentException("Extension must be positive.");
        }
        this.expiresAt = expiresAt.plus(duration);
    }

    public void revoke(String reason, OffsetDateTime now) {
        if (isRevoked()) {
            return;
        }
        this.revokedAt = now;
        this.revokedReason = reason;
    }

    public UUID getId() {
        return id;
    }

    public User getUser() {
        return user;
    }

    public String getRefreshToken() {
        return refreshToken;
    }

    public OffsetDateTime getIssuedAt() {
        return issuedAt;
    }

    public OffsetDateTime getExpiresAt() {
        return expiresAt;
    }

    public OffsetDateTime getRevokedAt() {
        return revokedAt;
    }

    public String getRevokedReason() {
        return revokedReason;
    }

    public String getDeviceId() {
        return deviceId;
    }

    public OffsetDateTime getLastActivityAt() {
        return lastActivityAt;
    }
}
