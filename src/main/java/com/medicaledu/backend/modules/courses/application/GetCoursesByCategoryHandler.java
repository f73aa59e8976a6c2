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
public class GetCoursesByCategoryHandler implements RequestHandler<GetCoursesByCategoryQuery, Result<CoursePageResponse>> {

    private final CourseRepository courseRepository;

    public GetCoursesByCategoryHandler(CourseRepository courseRepository) {
        this.courseRepository = courseRepository;
    }

    @Override
    public Result<CoursePageResponse> handle(GetCoursesByCategoryQuery query) {
        PageRequest pageRequest = PageRequest.of(query.page(), query.pageSize(), Sort.by(Sort.Direction.DESC, "publishedAt"));
        return Result.success(CoursePageResponse.from(
                courseRepository.findByCategoryAndPublishedTrueAndDeletedAtIsNull(query.category(), pageRequest)));
    }
}
