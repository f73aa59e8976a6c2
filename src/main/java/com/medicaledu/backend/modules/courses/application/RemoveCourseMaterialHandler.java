package com.medicaledu.backend.modules.courses.application;

import java.time.Clock;
import java.time.OffsetDateTime;

import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.RequestHandler;
import com.medicaledu.backend.modules.courses.domain.Course;
import com.medicaledu.backend.modules.courses.infrastructure.persistence.CourseRepository;
import com.medicaledu.backend.modules.courses.presentation.dto.CourseResponse;

import org.springframework.stereotype.Service;

@Service
public class RemoveCourseMaterialHandler implements RequestHandler<RemoveCourseMaterialCommand, Result<CourseResponse>> {

    private final CourseRepository courseRepository;
    private final Clock clock;

    public RemoveCourseMaterialHandler(CourseRepository courseRepository, Clock clock) {
        this.courseRepository = courseRepository;
        this.clock = clock;
    }

    @Override
    public Result<CourseResponse> handle(RemoveCourseMaterialCommand command) {
        Course course = courseRepository.findById(command.courseId()).orElse(null);
        if (course == null) {
            return Result.notFound("COURSE_NOT_FOUND");
        }
        if (course.findMaterial(command.materialId()) == null) {
            return Result.notFound("MATERIAL_NOT_FOUND");
        }
        course.removeMaterial(command.materialId(), OffsetDateTime.now(clock));
        courseRepository.save(course);
        return Result.success(CourseResponse.from(course));
    }
}
