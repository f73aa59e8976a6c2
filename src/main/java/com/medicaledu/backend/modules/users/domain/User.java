package com.medicaledu.backend.modules.users.domain;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.UUID;

import com.medicaledu.backend.global.common.domain.Email;
import com.medicaledu.backend.global.common.domain.Url;
import com.medicaledu.backend.global.jpa.AbstractAggregateEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

@Entity
@Table(name = "users")
public class User extends AbstractAggregateEntity {

    public static final int NAME_MAX_LENGTH = 100;
    public static final String DEFAULT_TIME_ZONE = "UTC";

    @Id
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "name", nullable = false, length = NAME_MAX_LENGTH)
    private String name;

    @Column(name = "email", nullable = false, unique = true, length = 254)
    private Email email;

    @Column(name = "password_hash", nullable = false, length = 255)
    private String passwordHash;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 20)
    private UserRole role;

    @Column(name = "active", nullable = false)
    private boolean active = true;

    @Column(name = "email_confirmed", nullable = false)
    private boolean emailConfirmed;

    @Column(name = "email_confirmation_token", length = 100)
    private String emailConfirmationToken;

    @Column(name = "email_confirmation_token_expires_at")
    private OffsetDateTime emailConfirmationTokenExpiresAt;

    @Column(name = "password_reset_token", length = 100)
    private String passwordResetToken;

    @Column(name = "password_reset_token_expires_at")
    private OffsetDateTime passwordResetTokenExpiresAt;

    @Column(name = "time_zone", nullable = false, length = 64)
    private String timeZone = DEFAULT_TIME_ZONE;

    @Column(name = "phone_number", length = 32)
    private String phoneNumber;

    @Column(name = "profile_picture_url", length = 2048)
    private Url profilePictureUrl;

    @Column(name = "last_login_at")
    private OffsetDateTime lastLoginAt;

    @Column(name = "failed_login_attempts", nullable = false)
    private int failedLoginAttempts;

    @Column(name = "locked_until")
    private OffsetDateTime lockedUntil;

    protected User() {
    }

    public static User register(
            String name,
            Email email,
            String passwordHash,
            UserRole role,
            String confirmationToken,
            OffsetDateTime confirmationTokenExpiresAt,
            OffsetDateTime now
    ) {
        if (email == null) {
            throw new IllegalArgumentException("Email is required.");
        }
        if (passwordHash == null || passwordHash.isBlank()) {
            throw new IllegalArgumentException("Password hash is required.");
        }
        if (role == null) {
            throw new IllegalArgumentException("Role is required.");
        }
        User user = new User();
        user.id = UUID.randomUUID();
        user.name = requireName(name);
        user.email = email;
        user.passwordHash = passwordHash;
        user.role = role;
        user.emailConfirmationToken = confirmationToken;
        user.emailConfirmationTokenExpiresAt = confirmationTokenExpiresAt;
        user.registerEvent(new UserEvents.Registered(user.id, now, email.getValue(), role));
        return user;
    }

    public void confirmEmail(String token, OffsetDateTime now) {
        if (emailConfirmed) {
            throw new IllegalStateException("Email is already confirmed.");
        }
        if (token == null || emailConfirmationToken == null || !emailConfirmationToken.equals(token)) {
            throw new IllegalArgumentException("Invalid email confirmation token.");
        }
        if (emailConfirmationTokenExpiresAt != null && emailConfirmationTokenExpiresAt.isBefore(now)) {
            throw new IllegalStateException("Email confirmation token has expired.");
        }
        this.emailConfirmed = true;
        this.emailConfirmationToken = null;
        this.emailConfirmationTokenExpiresAt = null;
        registerEvent(new UserEvents.EmailConfirmed(id, now));
    }

    public void updatePassword(String newPasswordHash, OffsetDateTime now) {
        if (!active) {
            throw new IllegalStateException("Inactive users cannot change their password.");
        }
        if (newPasswordHash == null || newPasswordHash.isBlank()) {
            throw new IllegalArgumentException("Password hash is required.");
        }
        this.passwordHash = newPasswordHash;
        registerEvent(new UserEvents.PasswordChanged(id, now));
    }

    public boolean isLocked(OffsetDateTime now) {
        return lockedUntil != null && lockedUntil.isAfter(now);
    }

    public void lock(OffsetDateTime until, OffsetDateTime now) {
        if (isLocked(now)) {
            throw new IllegalStateException("User is already locked.");
        }
        if (until == null || !until.isAfter(now)) {
            throw new IllegalArgumentException("Lock must end in the future.");
        }
        this.lockedUntil = until;
        registerEvent(new UserEvents.Locked(id, now, until));
    }

    /**
     * Counts a failed password check and locks the account once {@code maxAttempts} is reached.
     *
     * @return {@code true} when this attempt locked the account
     */
    public boolean recordFailedLogin(int maxAttempts, Duration lockoutDuration, OffsetDateTime now) {
        this.failedLoginAttempts++;
        if (failedLoginAttempts >= maxAttempts) {
            lock(now.plus(lockoutDuration), now);
            this.failedLoginAttempts = 0;
            return true;
        }
        return false;
    }

    public void recordSuccessfulLogin(OffsetDateTime now) {
        this.failedLoginAttempts = 0;
        this.lockedUntil = null;
        this.lastLoginAt = now;
        registerEvent(new UserEvents.LoggedIn(id, now));
    }

    public void recordLogout(OffsetDateTime now) {
        registerEvent(new UserEvents.LoggedOut(id, now));
    }

    public void issuePasswordReset(String token, OffsetDateTime expiresAt, OffsetDateTime now) {
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("Password reset token is required.");
        }
        this.passwordResetToken = token;
        this.passwordResetTokenExpiresAt = expiresAt;
        registerEvent(new UserEvents.PasswordResetRequested(id, now));
    }

    public void verifyAndConsumePasswordResetToken(String token, OffsetDateTime now) {
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("Password reset token is required.");
        }
        if (passwordResetToken == null || !passwordResetToken.equals(token)) {
            throw new IllegalStateException("Invalid password reset token.");
        }
        if (passwordResetTokenExpiresAt != null && passwordResetTokenExpiresAt.isBefore(now)) {
            throw new IllegalStateException("Password reset token has expired.");
        }
        this.passwordResetToken = null;
        this.passwordResetTokenExpiresAt = null;
        registerEvent(new UserEvents.PasswordReset(id, now));
    }

    public void updateProfile(String name, String timeZone, String phoneNumber, Url profilePictureUrl, OffsetDateTime now) {
        if (name != null) {
            this.name = requireName(name);
        }
        if (timeZone != null) {
            this.timeZone = requireTimeZone(timeZone);
        }
        this.phoneNumber = phoneNumber == null || phoneNumber.isBlank() ? null : phoneNumber.trim();
        this.profilePictureUrl = profilePictureUrl;
        registerEvent(new UserEvents.ProfileUpdated(id, now));
    }

    public void updateName(String name, OffsetDateTime now) {
        this.name = requireName(name);
        registerEvent(new UserEvents.ProfileUpdated(id, now));
    }

    public void activate(OffsetDateTime now) {
        if (active) {
            throw new IllegalStateException("User is already active.");
        }
        this.active = true;
        registerEvent(new UserEvents.Activated(id, now));
    }

    public void deactivate(OffsetDateTime now) {
        if (!active) {
            throw new IllegalStateException("User is already inactive.");
        }
        this.active = false;
        registerEvent(new UserEvents.Deactivated(id, now));
    }

    private static String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Name is required.");
        }
        String trimmed = name.trim();
        if (trimmed.length() > NAME_MAX_LENGTH) {
            throw new IllegalArgumentException("Name must not exceed " + NAME_MAX_LENGTH + " characters.");
        }
        return trimmed;
    }

    private static String requireTimeZone(String timeZone) {
        try {
            return ZoneId.of(timeZone.trim()).getId();
        } catch (DateTimeException ex) {
            throw new IllegalArgumentException("Unknown time zone: " + timeZone, ex);
        }
    }

    @Override
    public UUID getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public Email getEmail() {
        return email;
    }

    public String getPasswordHash() {
        return passwordHash;
    }

    public UserRole getRole() {
        return role;
    }

    public boolean isActive() {
        return active;
    }

    public boolean isEmailConfirmed() {
        return emailConfirmed;
    }

    public String getEmailConfirmationToken() {
        return emailConfirmationToken;
    }

    public OffsetDateTime getEmailConfirmationTokenExpiresAt() {
        return emailConfirmationTokenExpiresAt;
    }

    public String getPasswordResetToken() {
        return passwordResetToken;
    }

    public OffsetDateTime getPasswordResetTokenExpiresAt() {
        return passwordResetTokenExpiresAt;
    }

    public String getTimeZone() {
        return timeZone;
    }

    public String getPhoneNumber() {
        return phoneNumber;
    }

    public Url getProfilePictureUrl() {
        return profilePictureUrl;
    }

    public OffsetDateTime getLastLoginAt() {
        return lastLoginAt;
    }

    public int getFailedLoginAttempts() {
        return failedLoginAttempts;
    }

    public OffsetDateTime getLockedUntil() {
        return lockedUntil;
    }
}
