package com.medicaledu.backend.modules.bookings.presentation.dto;

public record UpdateBookingNotesRequest(
        String studentNotes,
        String instructorNotes,
        String meetingUrl,
        String meetingNotes
) {
}
