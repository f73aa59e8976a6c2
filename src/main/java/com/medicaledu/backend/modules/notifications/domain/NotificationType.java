package com.medicaledu.backend.modules.notifications.domain;

public enum NotificationType {
    BOOKING_REQUESTED,
    BOOKING_CONFIRMATION,
    BOOKING_REMINDER,
    BOOKING_CANCELLATION,
    BOOKING_RESCHEDULED,
    PAYMENT_CONFIRMATION,
    PAYMENT_FAILED,
    COURSE_PUBLISHED,
    COURSE_UPDATED,
    EMAIL_VERIFICATION,
    PASSWORD_RESET,
    GENERAL_ANNOUNCEMENT
}
