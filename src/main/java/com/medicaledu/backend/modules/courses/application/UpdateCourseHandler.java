package com.medicaledu.backend.modules.courses.application;

import java.time.Clock;
import java.time.OffsetDateTime;

import com.medicaledu.backend.global.common.domain.Currency;
import com.medicaledu.backend.global.common.domain.Money;
import com.medicaledu.backend.global.common.result.Result;
import com.medicaledu.backend.global.pipeline.RequestHandler;
import com.medicaledu.backend.modules.courses.domain.Course;
import com.medicaledu.backend.modules.courses.infrastructure.persistence.CourseRepository;
import com.medicaledu.backend.modules.courses.presentation.dto.CourseResponse;

import org.springframework.stereotype.Service;

@Service
public class UpdateCourseHandler implements RequestHandler<UpdateCourseCommand, Result<CourseResponse>> {

    private final CourseRepository courseRepository;
    private final Clock clock;

    public UpdateCourseHandler(CourseRepository courseRepository, Clock clock) {
        this.courseRepository = courseRepository;
        this.clock = clock;
    }

    @Override
    public Result<CourseResponse> handle(UpdateCourseCommand command) {
        Course course = courseRepository.findById(command.courseId()).orElse(null);
        if (course == null) {
            return Result.notFound("COURSE_NOT_FOUND");
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        course.updateDetails(
                command.title(),
                command.description(),
                command.durationMinutes(),
                command.maxStudents(),
                command.category(),
                command.difficultyLevel(),
                command.tags(),
                CourseMaterialDrafts.optionalUrl(command.thumbnailUrl()),
                CourseMaterialDrafts.optionalUrl(command.videoUrl()),
                now
        );
        if (command.price() != null) {
            Currency currency = command.currency() != null
                    ? Currency.of(command.currency())
                    : course.getPrice().getCurrency();
            course.updatePrice(Money.of(command.price(), currency), now);
        }
        if (command.materials() != null) {
            course.replaceMaterials(CourseMaterialDrafts.from(command.materials()), now);
        }
        courseRepository.save(course);
        return Result.success(CourseResponse.from(course));
    }
}
