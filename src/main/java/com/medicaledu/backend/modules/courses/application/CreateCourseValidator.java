package com.medicaledu.backend.modules.courses.application;

import java.util.ArrayList;
import java.util.List;

import com.medicaledu.backend.global.pipeline.RequestValidator;
import com.medicaledu.backend.modules.users.domain.UserRole;
import com.medicaledu.backend.modules.users.infrastructure.persistence.UserRepository;

import org.springframework.stereotype.Component;

@Component
public class CreateCourseValidator implements RequestValidator<CreateCourseCommand> {

    private final UserRepository userRepository;

    public CreateCourseValidator(UserRepository userRepository) {
        this.userRepository = userRepository;
    }

    @Override
    public List<String> validate(CreateCourseCommand command) {
        List<String> errors = new ArrayList<>(
                CourseMaterialDrafts.validateUrls(command.thumbnailUrl(), command.videoUrl(), command.materials()));
        if (!command.currency().matches("(?i)^[a-z]{3}$")) {
            errors.add("currency: must be a three letter code");
        }
        boolean isInstructor = userRepository.findById(command.instructorId())
                .map(user -> user.getRole() == UserRole.INSTRUCTOR && user.isActive())
                .orElse(false);
        if (!isInstructor) {
            errors.add("instructorId: must reference an active instructor");
        }
        return errors;
    }
}
