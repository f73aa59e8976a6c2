package com.medicaledu.backend.modules.users.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.medicaledu.backend.global.common.domain.AuditActionType;

public final class UserEvents {

    private UserEvents() {
    }

    public record Registered(UUID aggregateId, OffsetDateTime occurredAt, String email, UserRole role) implements UserEvent {
        @Override
        public AuditActionType auditAction() {
            return AuditActionType.CREATE;
        }
    }

    public record EmailConfirmed(UUID aggregateId, OffsetDateTime occurredAt) implements UserEvent {
        @Override
        public AuditActionType auditAction() {
            return AuditActionType.EMAIL_CONFIRMATION;
        }
    }

    public record PasswordChanged(UUID aggregateId, OffsetDateTime occurredAt) implements UserEvent {
    }

    public record PasswordResetRequested(UUID aggregateId, OffsetDateTime occurredAt) implements UserEvent {
        @Override
        public AuditActionType auditAction() {
            return AuditActionType.PASSWORD_RESET;
        }
    }

    public record PasswordReset(UUID aggregateId, OffsetDateTime occurredAt) implements UserEvent {
        @Override
        public AuditActionType auditAction() {
            return AuditActionType.PASSWORD_RESET;
        }
    }

    public record ProfileUpdated(UUID aggregateId, OffsetDateTime occurredAt) implements UserEvent {
    }

    public record Activated(UUID aggregateId, OffsetDateTime occurredAt) implements UserEvent {
    }

    public record Deactivated(UUID aggregateId, OffsetDateTime occurredAt) implements UserEvent {
    }

    public record Locked(UUID aggregateId, OffsetDateTime occurredAt, OffsetDateTime lockedUntil) implements UserEvent {
    }

    public record LoggedIn(UUID aggregateId, OffsetDateTime occurredAt) implements UserEvent {
        @Override
        public AuditActionType auditAction() {
            return AuditActionType.LOGIN;
        }
    }

    public record LoggedOut(UUID aggregateId, OffsetDateTime occurredAt) implements UserEvent {
        @Override
        public AuditActionType auditAction() {
            return AuditActionType.LOGOUT;
        }
    }
}
