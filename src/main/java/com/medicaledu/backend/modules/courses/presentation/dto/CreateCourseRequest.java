package com.medicaledu.backend.modules.courses.presentation.dto;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import com.medicaledu.backend.modules.courses.domain.CourseCategory;
import com.medicaledu.backend.modules.courses.domain.DifficultyLevel;

public record CreateCourseRequest(
        UUID instructorId,
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
