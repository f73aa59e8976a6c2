package com.medicaledu.backend.modules.bookings.presentation.dto;

import java.util.UUID;

public record RescheduleBookingRequest(UUID newSlotId) {
}
