package com.medicaledu.backend.modules.courses.application;

import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.RequestHandler;
import com.medicaledu.backend.modules.courses.infrastructure.persistence.CourseRepository;
import com.medicaledu.backend.modules.courses.presentation.dto.CoursePageResponse;

import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
public class GetCoursesByInstructorHandler
        implements RequestHandler<GetCoursesByInstructorQuery, Result<CoursePageResponse>> {

    private final CourseRepository courseRepository;

    public GetCoursesByInstructorHandler(CourseRepository courseRepository) {
        this.courseRepository = courseRepository;
    }

    @Override
    public Result<CoursePageResponse> handle(GetCoursesByInstructorQuery query) {
        PageRequest pageRequest = PageRequest.of(query.page(), query.pageSize(), Sort.by(Sort.Direction.DESC, "createdAt"));
        return Result.success(CoursePageResponse.from(
                courseRepository.findByInstructorIdAndDeletedAtIsNull(query.instructorId(), pageRequest)));
    }
}
