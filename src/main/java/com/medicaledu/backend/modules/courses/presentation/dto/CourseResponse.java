package com.medicaledu.backend.modules.courses.presentation.dto;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.medicaledu.backend.modules.courses.domain.Course;
import com.medicaledu.backend.modules.courses.domain.CourseCategory;
import com.medicaledu.backend.modules.courses.domain.DifficultyLevel;

public record CourseResponse(
        UUID id,
        UUID instructorId,
        String title,
        String description,
        BigDecimal price,
        String currency,
        int durationMinutes,
        int maxStudents,
        CourseCategory category,
        DifficultyLevel difficultyLevel,
        List<String> tags,
        String thumbnailUrl,
        String videoUrl,
        boolean published,
        OffsetDateTime publishedAt,
        boolean active,
        List<CourseMaterialResponse> materials,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static CourseResponse from(Course course) {
        return new CourseResponse(
                course.getId(),
                course.getInstructorId(),
                course.getTitle(),
                course.getDescription(),
                course.getPrice().getAmount(),
                course.getPrice().getCurrency().getCode(),
                course.getDurationMinutes(),
                course.getMaxStudents(),
                course.getCategory(),
                course.getDifficultyLevel(),
                List.copyOf(course.getTags()),
                course.getThumbnailUrl() != null ? course.getThumbnailUrl().getValue() : null,
                course.getVideoUrl() != null ? course.getVideoUrl().getValue() : null,
                course.isPublished(),
                course.getPublishedAt(),
                course.isActive(),
                course.getMaterials().stream().map(CourseMaterialResponse::from).toList(),
                course.getCreatedAt(),
                course.getUpdatedAt()
        );
    }
}
