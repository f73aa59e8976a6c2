package com.medicaledu.backend.modules.courses.application;

import java.time.Clock;
import java.time.OffsetDateTime;

import com.medicaledu.backend.global.common.domain.Money;
import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.RequestHandler;
import com.medicaledu.backend.modules.courses.domain.Course;
import com.medicaledu.backend.modules.courses.domain.CourseMaterialDraft;
import com.medicaledu.backend.modules.courses.infrastructure.persistence.CourseRepository;
import com.medicaledu.backend.modules.courses.presentation.dto.CourseResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class CreateCourseHandler implements RequestHandler<CreateCourseCommand, Result<CourseResponse>> {

    private static final Logger log = LoggerFactory.getLogger(CreateCourseHandler.class);

    private final CourseRepository courseRepository;
    private final Clock clock;

    public CreateCourseHandler(CourseRepository courseRepository, Clock clock) {
        this.courseRepository = courseRepository;
        this.clock = clock;
    }

    @Override
    public Result<CourseResponse> handle(CreateCourseCommand command) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        Course course = Course.create(
                command.instructorId(),
                command.title(),
                command.description(),
                Money.of(command.price(), command.currency()),
                command.durationMinutes(),
                command.maxStudents(),
                command.category(),
                command.difficultyLevel(),
                command.tags(),
                CourseMaterialDrafts.optionalUrl(command.thumbnailUrl()),
                CourseMaterialDrafts.optionalUrl(command.videoUrl()),
                now
        );
        for (CourseMaterialDraft draft : CourseMaterialDrafts.from(command.materials())) {
            course.addMaterial(draft, now);
        }
        courseRepository.save(course);
        log.info("Created course {} for instructor {}", course.getId(), course.getInstructorId());
        return Result.success(CourseResponse.from(course));
    }
}
