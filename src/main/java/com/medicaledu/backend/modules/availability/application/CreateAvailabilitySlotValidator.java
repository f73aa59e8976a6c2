package com.medicaledu.backend.modules.availability.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

import com.medicaledu.backend.global.pipeline.RequestValidator;
import com.medicaledu.backend.modules.courses.infrastructure.persistence.CourseRepository;

import org.springframework.stereotype.Component;

@Component
public class CreateAvailabilitySlotValidator implements RequestValidator<CreateAvailabilitySlotCommand> {

    private final CourseRepository courseRepository;
    private final Clock clock;

    public CreateAvailabilitySlotValidator(CourseRepository courseRepository, Clock clock) {
        this.courseRepository = courseRepository;
        this.clock = clock;
    }

    @Override
    public List<String> validate(CreateAvailabilitySlotCommand command) {
        List<String> errors = new ArrayList<>();
        if (!command.endTimeUtc().isAfter(command.startTimeUtc())) {
            errors.add("endTimeUtc: must be after startTimeUtc");
        }
        if (command.startTimeUtc().isBefore(OffsetDateTime.now(clock))) {
            errors.add("startTimeUtc: must be in the future");
        }
        if (!command.currency().matches("(?i)^[a-z]{3}$")) {
            errors.add("currency: must be a three letter code");
        }
        boolean ownedCourse = courseRepository.findById(command.courseId())
                .map(course -> course.isActive() && course.getInstructorId().equals(command.instructorId()))
                .orElse(false);
        if (!ownedCourse) {
            errors.add("courseId: must reference an active course taught by the instructor");
        }
        return errors;
    }
}
