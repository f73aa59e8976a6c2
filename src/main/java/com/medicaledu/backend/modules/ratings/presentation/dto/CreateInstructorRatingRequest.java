package com.medicaledu.backend.modules.ratings.presentation.dto;

import java.util.UUID;

public record CreateInstructorRatingRequest(UUID bookingId, UUID studentId, Integer rating, String review, Boolean isPublic) {
}
