package com.medicaledu.backend.modules.courses.application;

import java.util.Locale;

import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.RequestHandler;
import com.medicaledu.backend.modules.courses.infrastructure.persistence.CourseRepository;
import com.medicaledu.backend.modules.courses.infrastructure.persistence.CourseSearchCondition;
import com.medicaledu.backend.modules.courses.infrastructure.persistence.CourseSortField;
import com.medicaledu.backend.modules.courses.presentation.dto.CoursePageResponse;

import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
public class GetAllCoursesHandler implements RequestHandler<GetAllCoursesQuery, Result<CoursePageResponse>> {

    private final CourseRepository courseRepository;

    public GetAllCoursesHandler(CourseRepository courseRepository) {
        this.courseRepository = courseRepository;
    }

    @Override
    public Result<CoursePageResponse> handle(GetAllCoursesQuery query) {
        CourseSearchCondition condition = new CourseSearchCondition(
                query.isPublished(),
                query.isActive(),
                query.instructorId(),
                query.title(),
                query.description(),
                query.category(),
                query.minPrice(),
                query.maxPrice(),
                query.currency() == null ? null : query.currency().toUpperCase(Locale.ROOT),
                query.createdFrom(),
                query.createdTo(),
                query.publishedFrom(),
                query.publishedTo(),
                query.minDuration(),
                query.maxDuration(),
                query.minMaxStudents(),
                query.maxMaxStudents(),
                CourseSortField.fromParameter(query.sortBy()),
                "asc".equalsIgnoreCase(query.sortDirection()) ? Sort.Direction.ASC : Sort.Direction.DESC
        );
        PageRequest pageRequest = PageRequest.of(query.page(), query.pageSize());
        return Result.success(CoursePageResponse.from(courseRepository.searchCourses(condition, pageRequest)));
    }
}
