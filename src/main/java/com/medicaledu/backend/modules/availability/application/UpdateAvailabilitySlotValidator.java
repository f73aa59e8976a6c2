package com.medicaledu.backend.modules.availability.application;

import java.util.ArrayList;
import java.util.List;

import com.medicaledu.backend.global.pipeline.RequestValidator;

import org.springframework.stereotype.Component;

@Component
public class UpdateAvailabilitySlotValidator implements RequestValidator<UpdateAvailabilitySlotCommand> {

    @Override
    public List<String> validate(UpdateAvailabilitySlotCommand command) {
        List<String> errors = new ArrayList<>();
        if ((command.startTimeUtc() == null) != (command.endTimeUtc() == null)) {
            errors.add("startTimeUtc: start and end time must be given together");
        } else if (command.startTimeUtc() != null && !command.endTimeUtc().isAfter(command.startTimeUtc())) {
            errors.add("endTimeUtc: must be after startTimeUtc");
        }
        if (command.currency() != null && command.price() == null) {
            errors.add("price: is required when currency is given");
        }
        if (command.currency() != null && !command.currency().matches("(?i)^[a-z]{3}$")) {
            errors.add("currency: must be a three letter code");
        }
        return errors;
    }
}
