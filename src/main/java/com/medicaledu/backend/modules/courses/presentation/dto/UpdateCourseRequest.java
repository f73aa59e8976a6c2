package com.medicaledu.backend.modules.courses.presentation.dto;

import java.math.BigDecimal;
import java.util.List;

import com.medicaledu.backend.modules.courses.domain.CourseCategory;
import com.medicaledu.backend.modules.courses.domain.DifficultyLevel;

/**
 * Partial update; {@code null} fields are left unchanged. A non-null {@code materials} list
 * replaces the existing materials.
 */
public record UpdateCourseRequest(
        String title,
        String description,
        BigDecimal price,
        String currency,
        Integer durationMinutes,
        Integer maxStudents,
        CourseCategory category,
        DifficultyLevel difficultyLevel,
        List<String> tags,
        String thumbnailUrl,
        String videoUrl,
        List<CourseMaterialRequest> materials
) {
}
