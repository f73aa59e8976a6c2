package com.medicaledu.backend.global.common.domain;

public enum AuditActionType {
    CREATE,
    UPDATE,
    DELETE,
    LOGIN,
    LOGOUT,
    EMAIL_CONFIRMATION,
    PASSWORD_RESET,
    BOOKING_CREATED,
    BOOKING_UPDATED,
    PAYMENT_PROCESSED
}
