package com.medicaledu.backend.modules.ratings.presentation.dto;

import java.util.UUID;

public record CreateCourseRatingRequest(UUID courseId, UUID studentId, Integer rating, String review, Boolean isPublic) {
}
