package com.medicaledu.backend.modules.ratings.presentation.dto;

public record UpdateCourseRatingRequest(Integer rating, String review, Boolean isPublic) {
}
