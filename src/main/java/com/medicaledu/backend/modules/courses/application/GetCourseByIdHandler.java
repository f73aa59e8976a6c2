package com.medicaledu.backend.modules.courses.application;

import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.RequestHandler;
import com.medicaledu.backend.modules.courses.infrastructure.persistence.CourseRepository;
import com.medicaledu.backend.modules.courses.presentation.dto.CourseResponse;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
public class GetCourseByIdHandler implements RequestHandler<GetCourseByIdQuery, Result<CourseResponse>> {

    private final CourseRepository courseRepository;

    public GetCourseByIdHandler(CourseRepository courseRepository) {
        this.courseRepository = courseRepository;
    }

    @Override
    public Result<CourseResponse> handle(GetCourseByIdQuery query) {
        return courseRepository.findById(query.courseId())
                .map(course -> Result.success(CourseResponse.from(course)))
                .orElseGet(() -> Result.notFound("COURSE_NOT_FOUND"));
    }
}
