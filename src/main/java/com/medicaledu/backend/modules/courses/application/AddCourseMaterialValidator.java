package com.medicaledu.backend.modules.courses.application;

import java.util.List;

import com.medicaledu.backend.global.pipeline.RequestValidator;

import org.springframework.stereotype.Component;

@Component
public class AddCourseMaterialValidator implements RequestValidator<AddCourseMaterialCommand> {

    @Override
    public List<String> validate(AddCourseMaterialCommand command) {
        return CourseMaterialDrafts.validateUrls(null, null, List.of(command.material()));
    }
}
