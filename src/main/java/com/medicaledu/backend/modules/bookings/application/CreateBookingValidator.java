package com.medicaledu.backend.modules.bookings.application;

import java.util.ArrayList;
import java.util.List;

import com.medicaledu.backend.global.common.domain.PromoCodeValue;
import com.medicaledu.backend.global.pipeline.RequestValidator;
import com.medicaledu.backend.modules.users.domain.UserRole;
import com.medicaledu.backend.modules.users.infrastructure.persistence.UserRepository;

import org.springframework.stereotype.Component;

@Component
public class CreateBookingValidator implements RequestValidator<CreateBookingCommand> {

    private final UserRepository userRepository;

    public CreateBookingValidator(UserRepository userRepository) {
        this.userRepository = userRepository;
    }

    @Override
    public List<String> validate(CreateBookingCommand command) {
        List<String> errors = new ArrayList<>();
        if (command.promoCode() != null && !command.promoCode().isBlank() && !PromoCodeValue.isValid(command.promoCode())) {
            errors.add("promoCode: must be 4 to 20 letters or digits");
        }
        boolean isStudent = userRepository.findById(command.studentId())
                .map(user -> user.getRole() == UserRole.STUDENT && user.isActive())
                .orElse(false);
        if (!isStudent) {
            errors.add("studentId: must reference an active student");
        }
        return errors;
    }
}
