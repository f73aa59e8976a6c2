package com.medicaledu.backend.modules.courses.infrastructure.persistence;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.medicaledu.backend.modules.courses.domain.CourseCategory;

import org.springframework.data.domain.Sort;

/**
 * Optional course filters; {@code null} means "no constraint".
 */
public record CourseSearchCondition(
        Boolean published,
        Boolean active,
        UUID instructorId,
        String titleContains,
        String descriptionContains,
        CourseCategory category,
        BigDecimal minPrice,
        BigDecimal maxPrice,
        String currency,
        OffsetDateTime createdFrom,
        OffsetDateTime createdTo,
        OffsetDateTime publishedFrom,
        OffsetDateTime publishedTo,
        Integer minDuration,
        Integer maxDuration,
        Integer minMaxStudents,
        Integer maxMaxStudents,
        CourseSortField sortBy,
        Sort.Direction sortDirection
) {

    public static CourseSearchCondition empty() {
        return new CourseSearchCondition(null, null, null, null, null, null, null, null, null,
                null, null, null, null, null, null, null, null, CourseSortField.CREATED_AT, Sort.Direction.DESC);
    }
}
