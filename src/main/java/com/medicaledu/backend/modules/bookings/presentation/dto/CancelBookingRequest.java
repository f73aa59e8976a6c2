package com.medicaledu.backend.modules.bookings.presentation.dto;

public record CancelBookingRequest(String reason) {
}
