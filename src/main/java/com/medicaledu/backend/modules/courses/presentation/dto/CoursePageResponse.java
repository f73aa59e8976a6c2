package com.medicaledu.backend.modules.courses.presentation.dto;

import java.util.List;

import com.medicaledu.backend.modules.courses.domain.Course;

import org.springframework.data.domain.Page;

public record CoursePageResponse(
        long totalCount,
        int page,
        int pageSize,
        int totalPages,
        boolean hasNextPage,
        boolean hasPreviousPage,
        List<CourseResponse> courses
) {

    public static CoursePageResponse from(Page<Course> page) {
        return new CoursePageResponse(
                page.getTotalElements(),
                page.getNumber(),
                page.getSize(),
                page.getTotalPages(),
                page.hasNext(),
                page.hasPrevious(),
                page.getContent().stream().map(CourseResponse::from).toList()
        );
    }
}
