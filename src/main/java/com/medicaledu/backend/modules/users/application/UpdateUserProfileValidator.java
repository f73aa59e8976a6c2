package com.medicaledu.backend.modules.users.application;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

import com.medicaledu.backend.global.common.domain.Url;
import com.medicaledu.backend.global.pipeline.RequestValidator;

import org.springframework.stereotype.Component;

@Component
public class UpdateUserProfileValidator implements RequestValidator<UpdateUserProfileCommand> {

    @Override
    public List<String> validate(UpdateUserProfileCommand command) {
        List<String> errors = new ArrayList<>();
        if (command.name() != null && command.name().isBlank()) {
            errors.add("name: must not be blank");
        }
        if (command.timeZone() != null && !ZoneId.getAvailableZoneIds().contains(command.timeZone().trim())) {
            errors.add("timeZone: unknown time zone");
        }
        if (command.profilePictureUrl() != null && !command.profilePictureUrl().isBlank()
                && !Url.isValid(command.profilePictureUrl())) {
            errors.add("profilePictureUrl: must be a valid http(s) URL");
        }
        return errors;
    }
}
