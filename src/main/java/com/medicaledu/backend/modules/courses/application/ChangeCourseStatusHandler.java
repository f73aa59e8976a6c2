package com.medicaledu.backend.modules.courses.application;

import java.time.Clock;
import java.time.OffsetDateTime;

import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.RequestHandler;
import com.medicaledu.backend.modules.courses.domain.Course;
import com.medicaledu.backend.modules.courses.infrastructure.persistence.CourseRepository;
import com.medicaledu.backend.modules.courses.presentation.dto.CourseResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class ChangeCourseStatusHandler implements RequestHandler<ChangeCourseStatusCommand, Result<CourseResponse>> {

    private static final Logger log = LoggerFactory.getLogger(ChangeCourseStatusHandler.class);

    private final CourseRepository courseRepository;
    private final Clock clock;

    public ChangeCourseStatusHandler(CourseRepository courseRepository, Clock clock) {
        this.courseRepository = courseRepository;
        this.clock = clock;
    }

    @Override
    public Result<CourseResponse> handle(ChangeCourseStatusCommand command) {
        Course course = courseRepository.findById(command.courseId()).orElse(null);
        if (course == null) {
            return Result.notFound("COURSE_NOT_FOUND");
        }

        Result<CourseResponse> rejection = checkTransition(course, command.action());
        if (rejection != null) {
            return rejection;
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        switch (command.action()) {
            case PUBLISH -> course.publish(now);
            case UNPUBLISH -> course.unpublish(now);
            case ACTIVATE -> course.activate(now);
            case DEACTIVATE -> course.deactivate(now);
        }
        courseRepository.save(course);
        log.info("Course {} status changed: {}", course.getId(), command.action());
        return Result.success(CourseResponse.from(course));
    }

    private static Result<CourseResponse> checkTransition(Course course, CourseStatusAction action) {
        return switch (action) {
            case PUBLISH -> {
                if (course.isPublished()) {
                    yield Result.conflict("COURSE_ALREADY_PUBLISHED");
                }
                if (!course.isActive()) {
                    yield Result.conflict("COURSE_INACTIVE");
                }
                if (course.getMaterials().isEmpty()) {
                    yield Result.failure("COURSE_HAS_NO_MATERIALS");
                }
                yield null;
            }
            case UNPUBLISH -> course.isPublished() ? null : Result.conflict("COURSE_NOT_PUBLISHED");
            case ACTIVATE -> course.isActive() ? Result.conflict("COURSE_ALREADY_ACTIVE") : null;
            case DEACTIVATE -> course.isActive() ? null : Result.conflict("COURSE_ALREADY_INACTIVE");
        };
    }
}
