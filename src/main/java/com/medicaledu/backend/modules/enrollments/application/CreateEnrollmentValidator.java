package com.medicaledu.backend.modules.enrollments.application;

import java.util.List;

import com.medicaledu.backend.global.pipeline.RequestValidator;
import com.medicaledu.backend.modules.users.domain.UserRole;
import com.medicaledu.backend.modules.users.infrastructure.persistence.UserRepository;

import org.springframework.stereotype.Component;

@Component
public class CreateEnrollmentValidator implements RequestValidator<CreateEnrollmentCommand> {

    private final UserRepository userRepository;

    public CreateEnrollmentValidator(UserRepository userRepository) {
        this.userRepository = userRepository;
    }

    @Override
    public List<String> validate(CreateEnrollmentCommand command) {
        boolean isStudent = userRepository.findById(command.studentId())
                .map(user -> user.getRole() == UserRole.STUDENT && user.isActive())
                .orElse(false);
        return isStudent ? List.of() : List.of("studentId: must reference an active student");
    }
}
