package com.medicaledu.backend.modules.bookings.domain;

public enum BookingStatus {
    PENDING,
    CONFIRMED,
    CANCELLED,
    COMPLETED,
    NO_SHOW,
    RESCHEDULED
}
