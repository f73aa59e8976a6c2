package com.medicaledu.backend.modules.courses.application;

import java.util.ArrayList;
import java.util.List;

import com.medicaledu.backend.global.pipeline.RequestValidator;

import org.springframework.stereotype.Component;

@Component
public class UpdateCourseValidator implements RequestValidator<UpdateCourseCommand> {

    @Override
    public List<String> validate(UpdateCourseCommand command) {
        List<String> errors = new ArrayList<>(
                CourseMaterialDrafts.validateUrls(command.thumbnailUrl(), command.videoUrl(), command.materials()));
        if (command.currency() != null && !command.currency().matches("(?i)^[a-z]{3}$")) {
            errors.add("currency: must be a three letter code");
        }
        if (command.currency() != null && command.price() == null) {
            errors.add("price: is required when currency is given");
        }
        if (command.title() != null && command.title().isBlank()) {
            errors.add("title: must not be blank");
        }
        return errors;
    }
}
