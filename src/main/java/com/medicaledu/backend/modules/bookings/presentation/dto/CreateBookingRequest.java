package com.medicaledu.backend.modules.bookings.presentation.dto;

import java.util.UUID;

public record CreateBookingRequest(
        UUID studentId,
        UUID slotId,
        String promoCode,
        String notes
) {
}
